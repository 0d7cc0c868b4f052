package com.verlumen.paramsweep.execution;

import com.verlumen.paramsweep.params.Combination;

/**
 * Scores one combination, typically by running a backtest with the combination's values bound
 * into a strategy.
 *
 * @param <O> type of the evaluation output
 */
@FunctionalInterface
public interface Evaluator<O> {
  /**
   * Evaluates a combination.
   *
   * @param combination the parameter values to evaluate
   * @return the evaluation output, never null
   * @throws EvaluationException if this combination cannot be evaluated
   */
  O evaluate(Combination combination) throws EvaluationException;

  /**
   * Whether this evaluator may be invoked concurrently from several workers. Evaluators that keep
   * shared mutable state return false and are always dispatched sequentially.
   */
  default boolean isReentrant() {
    return true;
  }
}
