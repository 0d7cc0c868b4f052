package com.verlumen.paramsweep.sweep;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.paramsweep.execution.CancellationToken;
import com.verlumen.paramsweep.execution.Evaluator;
import com.verlumen.paramsweep.execution.ResultSet;
import com.verlumen.paramsweep.execution.SweepScheduler;
import com.verlumen.paramsweep.execution.SweepStatus;
import com.verlumen.paramsweep.generation.CombinationGenerator;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.store.PersistenceException;
import com.verlumen.paramsweep.store.ResultStore;
import com.verlumen.paramsweep.store.SweepIdentity;
import java.util.Optional;

/**
 * Implementation of {@link SweepRunner}. Coordinates the sweep but delegates generation and
 * evaluation to {@link CombinationGenerator} and {@link SweepScheduler}.
 */
final class SweepRunnerImpl implements SweepRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CombinationGenerator combinationGenerator;
  private final SweepScheduler sweepScheduler;

  @Inject
  SweepRunnerImpl(CombinationGenerator combinationGenerator, SweepScheduler sweepScheduler) {
    this.combinationGenerator = combinationGenerator;
    this.sweepScheduler = sweepScheduler;
  }

  @Override
  public <O> SweepOutcome<O> run(
      Sweep sweep, Evaluator<O> evaluator, ResultStore<O> store, CancellationToken cancellation)
      throws PersistenceException {
    checkNotNull(sweep, "sweep");
    checkNotNull(evaluator, "evaluator");
    checkNotNull(store, "store");
    checkNotNull(cancellation, "cancellation");

    SweepIdentity identity = sweep.identity();
    Optional<ResultSet<O>> stored = store.load(identity);
    if (stored.isPresent()) {
      logger.atInfo().log("Reusing stored results for %s, skipping evaluation", identity);
      return SweepOutcome.create(identity, stored.get(), true);
    }

    ImmutableList<Combination> combinations =
        combinationGenerator.generate(sweep.space(), sweep.settings().samplingPlan());
    ResultSet<O> resultSet = sweepScheduler.schedule(
        combinations, evaluator, sweep.settings().schedulerSettings(), cancellation);

    if (resultSet.status() == SweepStatus.INCOMPLETE) {
      logger.atWarning().log(
          "Sweep %s is incomplete (%d of %d evaluated), not storing partial results",
          identity, resultSet.size(), resultSet.expectedCount());
    } else {
      store.save(identity, resultSet);
    }

    logger.atInfo().log(
        "Sweep %s finished with status %s: %d succeeded, %d failed",
        identity, resultSet.status(), resultSet.succeededCount(), resultSet.failedCount());
    return SweepOutcome.create(identity, resultSet, false);
  }
}
