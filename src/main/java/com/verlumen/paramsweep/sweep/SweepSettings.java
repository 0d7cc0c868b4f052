package com.verlumen.paramsweep.sweep;

import com.google.auto.value.AutoValue;
import com.verlumen.paramsweep.execution.SchedulerSettings;
import com.verlumen.paramsweep.generation.SamplingPlan;
import java.time.Duration;
import java.util.Optional;

/** Sweep-level settings: sampling budget, seed, worker-pool size and evaluation timeout. */
@AutoValue
public abstract class SweepSettings {
  /** Number of combinations to sample; zero evaluates every valid combination. */
  public abstract int sampleCount();

  public abstract long seed();

  /** Number of workers; zero or one evaluates sequentially on the calling thread. */
  public abstract int workerPoolSize();

  public abstract Optional<Duration> evaluationTimeout();

  public static Builder builder() {
    return new AutoValue_SweepSettings.Builder()
        .setSampleCount(0)
        .setSeed(SamplingPlan.DEFAULT_SEED)
        .setWorkerPoolSize(defaultWorkerPoolSize());
  }

  /** One worker per available processor. */
  public static int defaultWorkerPoolSize() {
    return Runtime.getRuntime().availableProcessors();
  }

  public SamplingPlan samplingPlan() {
    return SamplingPlan.create(sampleCount(), seed());
  }

  public SchedulerSettings schedulerSettings() {
    return SchedulerSettings.create(workerPoolSize(), evaluationTimeout());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSampleCount(int sampleCount);

    public abstract Builder setSeed(long seed);

    public abstract Builder setWorkerPoolSize(int workerPoolSize);

    public abstract Builder setEvaluationTimeout(Duration evaluationTimeout);

    abstract SweepSettings autoBuild();

    /** Builds the settings, validating them eagerly. */
    public SweepSettings build() {
      SweepSettings settings = autoBuild();
      settings.samplingPlan();
      settings.schedulerSettings();
      return settings;
    }
  }
}
