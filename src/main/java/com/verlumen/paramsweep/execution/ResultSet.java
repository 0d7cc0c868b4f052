package com.verlumen.paramsweep.execution;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.paramsweep.params.Combination;
import java.util.Optional;

/**
 * The results of one sweep, in generation order, with lookup by combination.
 *
 * <p>{@link SweepStatus#INCOMPLETE} result sets hold only the combinations that were evaluated
 * before the sweep was cancelled.
 */
@AutoValue
public abstract class ResultSet<O> {
  public abstract SweepStatus status();

  /** Number of combinations the sweep set out to evaluate. */
  public abstract int expectedCount();

  public abstract ImmutableList<SweepResult<O>> results();

  public static <O> ResultSet<O> create(
      SweepStatus status, int expectedCount, ImmutableList<SweepResult<O>> results) {
    checkNotNull(status, "status");
    checkArgument(results.size() <= expectedCount,
        "%s results exceed the %s expected", results.size(), expectedCount);
    switch (status) {
      case COMPLETE:
        checkArgument(results.size() == expectedCount && expectedCount > 0,
            "A complete result set holds every expected result");
        break;
      case NO_COMBINATIONS:
        checkArgument(expectedCount == 0, "No combinations means nothing was expected");
        break;
      case INCOMPLETE:
        checkArgument(results.size() < expectedCount,
            "An incomplete result set is missing at least one result");
        break;
    }
    return new AutoValue_ResultSet<>(status, expectedCount, results);
  }

  public static <O> ResultSet<O> noCombinations() {
    return create(SweepStatus.NO_COMBINATIONS, 0, ImmutableList.of());
  }

  @Memoized
  public ImmutableMap<Combination, SweepResult<O>> byCombination() {
    return results().stream()
        .collect(ImmutableMap.toImmutableMap(SweepResult::combination, result -> result));
  }

  public Optional<SweepResult<O>> find(Combination combination) {
    return Optional.ofNullable(byCombination().get(combination));
  }

  public boolean isComplete() {
    return status() == SweepStatus.COMPLETE;
  }

  public int size() {
    return results().size();
  }

  public long succeededCount() {
    return results().stream().filter(SweepResult::isSuccess).count();
  }

  public long failedCount() {
    return results().size() - succeededCount();
  }
}
