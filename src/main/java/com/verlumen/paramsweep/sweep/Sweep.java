package com.verlumen.paramsweep.sweep;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.auto.value.AutoValue;
import com.verlumen.paramsweep.generation.SweepSpace;
import com.verlumen.paramsweep.store.SweepIdentity;

/** Everything that defines one sweep: the strategy, its parameter space and the settings. */
@AutoValue
public abstract class Sweep {
  public abstract String strategyName();

  public abstract SweepSpace space();

  public abstract SweepSettings settings();

  public static Sweep create(String strategyName, SweepSpace space, SweepSettings settings) {
    checkArgument(!isNullOrEmpty(strategyName), "Strategy name cannot be empty");
    return new AutoValue_Sweep(strategyName, space, settings);
  }

  public SweepIdentity identity() {
    return SweepIdentity.derive(strategyName(), space(), settings().samplingPlan());
  }
}
