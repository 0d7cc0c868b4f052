package com.verlumen.paramsweep.execution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.util.Optional;

/** Worker-pool size and per-evaluation timeout used by a {@link SweepScheduler}. */
@AutoValue
public abstract class SchedulerSettings {
  public abstract int workerPoolSize();

  public abstract Optional<Duration> evaluationTimeout();

  public static SchedulerSettings create(int workerPoolSize, Optional<Duration> evaluationTimeout) {
    checkArgument(workerPoolSize >= 0, "Worker pool size cannot be negative: %s", workerPoolSize);
    evaluationTimeout.ifPresent(
        timeout -> checkArgument(!timeout.isNegative() && !timeout.isZero(),
            "Evaluation timeout must be positive: %s", timeout));
    return new AutoValue_SchedulerSettings(workerPoolSize, evaluationTimeout);
  }

  public static SchedulerSettings sequential() {
    return create(1, Optional.empty());
  }

  public static SchedulerSettings parallel(int workerPoolSize) {
    return create(workerPoolSize, Optional.empty());
  }

  public ExecutionMode executionMode() {
    return ExecutionMode.forWorkerPoolSize(workerPoolSize());
  }
}
