package com.verlumen.paramsweep.sweep;

import com.verlumen.paramsweep.execution.CancellationToken;
import com.verlumen.paramsweep.execution.Evaluator;
import com.verlumen.paramsweep.store.PersistenceException;
import com.verlumen.paramsweep.store.ResultStore;

/**
 * Runs a complete sweep: reuse stored results when present, otherwise generate, evaluate and
 * store.
 */
public interface SweepRunner {
  /**
   * Runs {@code sweep}.
   *
   * <p>When {@code store} already holds results for the sweep's identity they are returned and
   * {@code evaluator} is never invoked. Otherwise every valid combination is evaluated and the
   * result set is saved, unless the sweep was cancelled before finishing.
   *
   * @throws com.verlumen.paramsweep.params.SweepConfigurationException if the sweep is declared
   *     incorrectly; raised before any evaluation
   * @throws PersistenceException if the store cannot be read or written
   */
  <O> SweepOutcome<O> run(
      Sweep sweep, Evaluator<O> evaluator, ResultStore<O> store, CancellationToken cancellation)
      throws PersistenceException;

  default <O> SweepOutcome<O> run(Sweep sweep, Evaluator<O> evaluator, ResultStore<O> store)
      throws PersistenceException {
    return run(sweep, evaluator, store, CancellationToken.create());
  }
}
