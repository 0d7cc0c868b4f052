package com.verlumen.paramsweep.constraints;

import com.google.auto.value.AutoValue;

/** A relation that must hold between the values of two distributions. */
@AutoValue
public abstract class Constraint {
  public abstract String label();

  public abstract String leftLabel();

  public abstract String rightLabel();

  public abstract RelationalOperator operator();

  static Constraint create(
      String label, String leftLabel, String rightLabel, RelationalOperator operator) {
    return new AutoValue_Constraint(label, leftLabel, rightLabel, operator);
  }

  @Override
  public final String toString() {
    return String.format(
        "%s: %s %s %s", label(), leftLabel(), operator().symbol(), rightLabel());
  }
}
