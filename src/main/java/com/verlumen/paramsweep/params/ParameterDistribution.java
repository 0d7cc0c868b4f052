package com.verlumen.paramsweep.params;

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.verlumen.paramsweep.params.SweepConfigurationException.checkConfiguration;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;

/**
 * One swept parameter: a label, the place in the strategy it binds to and the ordered candidate
 * values to try.
 *
 * @param <T> type of the candidate values
 */
@AutoValue
public abstract class ParameterDistribution<T extends Comparable<? super T>> {
  public abstract String label();

  public abstract BindingTarget bindingTarget();

  /** Candidate values in declaration order. */
  public abstract ImmutableList<T> values();

  /** Type shared by every candidate value. */
  public abstract Class<?> valueType();

  public int size() {
    return values().size();
  }

  /**
   * Creates a distribution.
   *
   * @throws SweepConfigurationException if the label is blank, the binding target is missing, or
   *     the values are empty, contain nulls or duplicates, or mix types
   */
  public static <T extends Comparable<? super T>> ParameterDistribution<T> create(
      String label, BindingTarget bindingTarget, Iterable<T> values) {
    checkConfiguration(!isNullOrEmpty(label) && !label.isBlank(),
        "Distribution label cannot be empty");
    checkConfiguration(bindingTarget != null, "Distribution %s has no binding target", label);
    checkConfiguration(values != null, "Distribution %s has no candidate values", label);

    ImmutableList.Builder<T> builder = ImmutableList.builder();
    Set<T> seen = new HashSet<>();
    Class<?> valueType = null;
    for (T value : values) {
      checkConfiguration(value != null, "Distribution %s contains a null value", label);
      checkConfiguration(seen.add(value),
          "Distribution %s contains duplicate value %s", label, value);
      Class<?> type = Values.typeOf(value);
      if (valueType == null) {
        valueType = type;
      }
      checkConfiguration(valueType.equals(type),
          "Distribution %s mixes %s and %s values",
          label, valueType.getSimpleName(), type.getSimpleName());
      builder.add(value);
    }
    ImmutableList<T> candidates = builder.build();
    checkConfiguration(!candidates.isEmpty(), "Distribution %s has no candidate values", label);

    return new AutoValue_ParameterDistribution<>(label, bindingTarget, candidates, valueType);
  }
}
