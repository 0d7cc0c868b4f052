package com.verlumen.paramsweep.execution;

import com.google.common.collect.ImmutableList;
import com.verlumen.paramsweep.params.Combination;

/**
 * Evaluates every combination exactly once, sequentially or across a worker pool, and collects
 * the results in generation order.
 */
public interface SweepScheduler {
  /**
   * Dispatches each combination to {@code evaluator}.
   *
   * <p>Evaluation failures are recorded as failed results and never abort the sweep. When
   * {@code cancellation} fires, no new combination is dispatched and the returned result set is
   * {@link SweepStatus#INCOMPLETE}.
   *
   * @param combinations the combinations to evaluate, in generation order and without duplicates
   * @param evaluator evaluates one combination
   * @param settings worker-pool size and optional per-evaluation timeout
   * @param cancellation cooperative cancellation signal
   * @return one result per evaluated combination
   */
  <O> ResultSet<O> schedule(
      ImmutableList<Combination> combinations,
      Evaluator<O> evaluator,
      SchedulerSettings settings,
      CancellationToken cancellation);
}
