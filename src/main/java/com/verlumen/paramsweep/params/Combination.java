package com.verlumen.paramsweep.params;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * One fully bound assignment of a value to every distribution of a sweep.
 *
 * <p>Equality is structural: two combinations are equal when they map the same labels to equal
 * values. Iteration follows the declaration order of the distributions.
 */
@AutoValue
public abstract class Combination {
  public abstract ImmutableMap<String, Comparable<?>> values();

  public static Combination of(Map<String, ? extends Comparable<?>> values) {
    checkNotNull(values, "values");
    checkArgument(!values.isEmpty(), "A combination binds at least one distribution");
    return new AutoValue_Combination(ImmutableMap.copyOf(values));
  }

  public boolean contains(String label) {
    return values().containsKey(label);
  }

  /** Returns the value bound to {@code label}. */
  public Comparable<?> get(String label) {
    Comparable<?> value = values().get(label);
    checkArgument(value != null, "Combination %s does not bind %s", this, label);
    return value;
  }

  public <T> T get(String label, Class<T> type) {
    Comparable<?> value = get(label);
    checkArgument(type.isInstance(value),
        "Value of %s is a %s, not a %s",
        label, value.getClass().getSimpleName(), type.getSimpleName());
    return type.cast(value);
  }

  public int getInt(String label) {
    Comparable<?> value = get(label);
    checkArgument(value instanceof Integer, "Value of %s is not an integer: %s", label, value);
    return (Integer) value;
  }

  @Override
  public final String toString() {
    return values().toString();
  }
}
