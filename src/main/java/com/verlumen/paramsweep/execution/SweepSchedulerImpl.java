package com.verlumen.paramsweep.execution;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.inject.Inject;
import com.verlumen.paramsweep.params.Combination;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * {@link SweepScheduler} backed by a shared work queue.
 *
 * <p>The queue holds the generation index of every combination and is drained exactly once,
 * either by the calling thread or by a fixed pool of workers. Results land in a concurrent map
 * keyed by that index and are reassembled in generation order at the end.
 */
final class SweepSchedulerImpl implements SweepScheduler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int PROGRESS_STEPS = 10;

  @Inject
  SweepSchedulerImpl() {}

  @Override
  public <O> ResultSet<O> schedule(
      ImmutableList<Combination> combinations,
      Evaluator<O> evaluator,
      SchedulerSettings settings,
      CancellationToken cancellation) {
    checkNotNull(combinations, "combinations");
    checkNotNull(evaluator, "evaluator");
    checkNotNull(settings, "settings");
    checkNotNull(cancellation, "cancellation");

    if (combinations.isEmpty()) {
      logger.atInfo().log("No combinations to evaluate");
      return ResultSet.noCombinations();
    }

    ExecutionMode mode = resolveMode(settings, evaluator);
    int workers = mode == ExecutionMode.PARALLEL
        ? Math.min(settings.workerPoolSize(), combinations.size())
        : 1;
    logger.atInfo().log(
        "Evaluating %d combinations, mode=%s, workers=%d", combinations.size(), mode, workers);

    Optional<ExecutorService> timeoutExecutor =
        settings.evaluationTimeout().map(unused -> evaluationExecutor(evaluator));
    Dispatch<O> dispatch = new Dispatch<>(
        combinations,
        evaluator,
        timeoutExecutor,
        settings.evaluationTimeout(),
        cancellation);
    try {
      if (mode == ExecutionMode.SEQUENTIAL) {
        dispatch.drain();
      } else {
        runWorkers(dispatch, workers);
      }
    } finally {
      timeoutExecutor.ifPresent(ExecutorService::shutdownNow);
    }

    return dispatch.assemble();
  }

  private static ExecutionMode resolveMode(SchedulerSettings settings, Evaluator<?> evaluator) {
    ExecutionMode mode = settings.executionMode();
    if (mode == ExecutionMode.PARALLEL && !evaluator.isReentrant()) {
      logger.atWarning().log("Evaluator is not reentrant, falling back to sequential dispatch");
      return ExecutionMode.SEQUENTIAL;
    }
    return mode;
  }

  /**
   * Returns the executor that timed evaluations run on. A non-reentrant evaluator gets a single
   * thread so that an abandoned, timed-out call can never overlap the next one.
   */
  private static ExecutorService evaluationExecutor(Evaluator<?> evaluator) {
    ThreadFactory threadFactory = threadFactory("sweep-evaluation-%d");
    return evaluator.isReentrant()
        ? Executors.newCachedThreadPool(threadFactory)
        : Executors.newSingleThreadExecutor(threadFactory);
  }

  private static void runWorkers(Dispatch<?> dispatch, int workers) {
    ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory("sweep-worker-%d"));
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < workers; i++) {
      futures.add(pool.submit(dispatch::drain));
    }
    pool.shutdown();

    try {
      while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
        logger.atFine().log("Waiting for sweep workers");
      }
    } catch (InterruptedException e) {
      logger.atWarning().log("Interrupted while waiting for workers, cancelling sweep");
      dispatch.cancellation.cancel();
      Uninterruptibles.awaitTerminationUninterruptibly(pool);
      Thread.currentThread().interrupt();
    }

    // Surfaces errors thrown outside the per-combination failure handling.
    for (Future<?> future : futures) {
      Futures.getUnchecked(future);
    }
  }

  private static ThreadFactory threadFactory(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }

  /** State shared by the workers of one schedule call. */
  private static final class Dispatch<O> {
    private final ImmutableList<Combination> combinations;
    private final Evaluator<O> evaluator;
    private final Optional<ExecutorService> evaluationExecutor;
    private final Optional<TimeLimiter> timeLimiter;
    private final Optional<Duration> timeout;
    private final CancellationToken cancellation;
    private final Queue<Integer> queue;
    private final Map<Integer, SweepResult<O>> results = new ConcurrentHashMap<>();
    private final AtomicInteger completed = new AtomicInteger();
    private final int progressInterval;

    Dispatch(
        ImmutableList<Combination> combinations,
        Evaluator<O> evaluator,
        Optional<ExecutorService> evaluationExecutor,
        Optional<Duration> timeout,
        CancellationToken cancellation) {
      this.combinations = combinations;
      this.evaluator = evaluator;
      this.evaluationExecutor = evaluationExecutor;
      this.timeLimiter = evaluationExecutor.map(SimpleTimeLimiter::create);
      this.timeout = timeout;
      this.cancellation = cancellation;
      this.queue = IntStream.range(0, combinations.size())
          .boxed()
          .collect(ConcurrentLinkedQueue::new, Queue::add, Queue::addAll);
      this.progressInterval = Math.max(1, combinations.size() / PROGRESS_STEPS);
    }

    void drain() {
      while (!cancellation.isCancelled()) {
        Integer index = queue.poll();
        if (index == null) {
          return;
        }
        Combination combination = combinations.get(index);
        try {
          results.put(index, evaluate(combination));
        } catch (InterruptedException e) {
          logger.atWarning().log("Interrupted while evaluating %s, cancelling sweep", combination);
          cancellation.cancel();
          Thread.currentThread().interrupt();
          return;
        }
        int done = completed.incrementAndGet();
        if (done % progressInterval == 0) {
          logger.atInfo().log("Evaluated %d/%d combinations", done, combinations.size());
        }
      }
    }

    private SweepResult<O> evaluate(Combination combination) throws InterruptedException {
      try {
        O output = timeLimiter.isPresent()
            ? timeLimiter.get()
                .callWithTimeout(() -> evaluator.evaluate(combination), timeout.get())
            : evaluator.evaluate(combination);
        logger.atFine().log("Evaluated %s", combination);
        return SweepResult.succeeded(combination, output);
      } catch (TimeoutException e) {
        logger.atWarning().log("Evaluation of %s timed out after %s", combination, timeout.get());
        if (!evaluator.isReentrant()) {
          awaitAbandonedEvaluation(combination);
        }
        return SweepResult.failed(combination, "Evaluation timed out after " + timeout.get());
      } catch (ExecutionException | UncheckedExecutionException e) {
        return failure(combination, e.getCause());
      } catch (EvaluationException | RuntimeException e) {
        return failure(combination, e);
      }
    }

    /**
     * Blocks until the single evaluation thread is idle again. The barrier task only runs once
     * the timed-out call has returned or been skipped.
     */
    private void awaitAbandonedEvaluation(Combination combination) throws InterruptedException {
      logger.atFine().log("Waiting for timed-out evaluation of %s to return", combination);
      try {
        evaluationExecutor.get().submit(() -> {}).get();
      } catch (ExecutionException e) {
        throw new IllegalStateException("Evaluation barrier failed", e);
      }
    }

    private SweepResult<O> failure(Combination combination, Throwable cause) {
      logger.atWarning().withCause(cause).log("Evaluation of %s failed", combination);
      String detail = cause.getMessage() == null
          ? cause.getClass().getSimpleName()
          : cause.getClass().getSimpleName() + ": " + cause.getMessage();
      return SweepResult.failed(combination, detail);
    }

    ResultSet<O> assemble() {
      ImmutableList<SweepResult<O>> ordered = IntStream.range(0, combinations.size())
          .mapToObj(results::get)
          .filter(result -> result != null)
          .collect(ImmutableList.toImmutableList());
      if (ordered.size() < combinations.size()) {
        logger.atWarning().log(
            "Sweep cancelled after %d of %d combinations", ordered.size(), combinations.size());
        return ResultSet.create(SweepStatus.INCOMPLETE, combinations.size(), ordered);
      }
      logger.atInfo().log("Evaluated all %d combinations", ordered.size());
      return ResultSet.create(SweepStatus.COMPLETE, combinations.size(), ordered);
    }
  }
}
