package com.verlumen.paramsweep.generation;

import static com.verlumen.paramsweep.params.SweepConfigurationException.checkConfiguration;

import com.google.auto.value.AutoValue;

/** How many of the valid combinations to keep, and the seed used to pick them. */
@AutoValue
public abstract class SamplingPlan {
  public static final long DEFAULT_SEED = 42L;

  /** Number of combinations to sample; zero keeps every valid combination. */
  public abstract int sampleCount();

  public abstract long seed();

  public static SamplingPlan create(int sampleCount, long seed) {
    checkConfiguration(sampleCount >= 0, "Sample count cannot be negative: %s", sampleCount);
    return new AutoValue_SamplingPlan(sampleCount, seed);
  }

  public static SamplingPlan sampled(int sampleCount) {
    return create(sampleCount, DEFAULT_SEED);
  }

  public static SamplingPlan exhaustive() {
    return create(0, DEFAULT_SEED);
  }

  public boolean isExhaustive() {
    return sampleCount() == 0;
  }
}
