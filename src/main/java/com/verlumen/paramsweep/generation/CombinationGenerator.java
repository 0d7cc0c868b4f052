package com.verlumen.paramsweep.generation;

import com.google.common.collect.ImmutableList;
import com.verlumen.paramsweep.params.Combination;

/**
 * Materializes the valid combinations of a {@link SweepSpace}.
 *
 * <p>Combinations are produced in lexicographic order over the declaration order of the
 * distributions, with the first declared distribution varying slowest. Sampling, when requested,
 * is applied to the constraint-filtered combinations and keeps that order.
 */
public interface CombinationGenerator {
  /**
   * Generates the valid combinations of {@code space}, sampled according to {@code plan}.
   *
   * @return an ordered, duplicate-free list, empty when no combination satisfies the constraints
   */
  ImmutableList<Combination> generate(SweepSpace space, SamplingPlan plan);

  /** Number of combinations that satisfy every constraint, before sampling. */
  default int count(SweepSpace space) {
    return generate(space, SamplingPlan.exhaustive()).size();
  }
}
