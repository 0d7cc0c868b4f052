package com.verlumen.paramsweep.sweep;

import com.google.auto.value.AutoValue;
import com.verlumen.paramsweep.execution.ResultSet;
import com.verlumen.paramsweep.store.SweepIdentity;

/** Result set of a sweep, and whether it came from the store instead of fresh evaluation. */
@AutoValue
public abstract class SweepOutcome<O> {
  public abstract SweepIdentity identity();

  public abstract ResultSet<O> resultSet();

  public abstract boolean loadedFromStore();

  static <O> SweepOutcome<O> create(
      SweepIdentity identity, ResultSet<O> resultSet, boolean loadedFromStore) {
    return new AutoValue_SweepOutcome<>(identity, resultSet, loadedFromStore);
  }
}
