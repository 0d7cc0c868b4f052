package com.verlumen.paramsweep.execution;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.verlumen.paramsweep.params.Combination;
import java.util.Optional;

/**
 * Outcome of evaluating one combination: the evaluator output on success, an error detail on
 * failure.
 */
@AutoValue
public abstract class SweepResult<O> {
  public enum Status {
    SUCCEEDED,
    FAILED
  }

  public abstract Combination combination();

  public abstract Status status();

  public abstract Optional<O> output();

  public abstract Optional<String> errorDetail();

  public static <O> SweepResult<O> succeeded(Combination combination, O output) {
    checkNotNull(output, "Evaluator returned no output for %s", combination);
    return new AutoValue_SweepResult<>(
        combination, Status.SUCCEEDED, Optional.of(output), Optional.empty());
  }

  public static <O> SweepResult<O> failed(Combination combination, String errorDetail) {
    return new AutoValue_SweepResult<>(
        combination, Status.FAILED, Optional.empty(), Optional.of(errorDetail));
  }

  public boolean isSuccess() {
    return status() == Status.SUCCEEDED;
  }
}
