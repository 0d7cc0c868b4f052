package com.verlumen.paramsweep.params;

/**
 * Typed handle naming the place in a strategy that a {@link ParameterDistribution} sets.
 *
 * <p>Enums implement this interface directly, which lets an evaluator resolve its bindings once
 * when it is built instead of looking parameters up by name on every evaluation.
 */
public interface BindingTarget {
  /** Stable name of the target, used when deriving sweep identities. */
  String name();
}
