package com.verlumen.paramsweep.params;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Natural ordering of candidate values, including ordering across the boxed numeric types so that
 * an {@code Integer} distribution can be constrained against a {@code Long} or {@code Double} one.
 */
public final class Values {
  /** Returns the class that identifies the type of a candidate value. */
  public static Class<?> typeOf(Object value) {
    if (value instanceof Enum) {
      return ((Enum<?>) value).getDeclaringClass();
    }
    return value.getClass();
  }

  /** Whether values of the two types can be ordered against each other. */
  public static boolean areComparable(Class<?> left, Class<?> right) {
    if (left.equals(right)) {
      return true;
    }
    return Number.class.isAssignableFrom(left) && Number.class.isAssignableFrom(right);
  }

  /**
   * Compares two candidate values by natural ordering.
   *
   * <p>Numbers of different types compare by exact value, except that a NaN or infinite floating
   * point operand makes both sides compare as doubles, with NaN above positive infinity.
   *
   * @throws IllegalArgumentException if the values are of types that cannot be ordered together
   */
  public static int compare(Comparable<?> left, Comparable<?> right) {
    Class<?> leftType = typeOf(left);
    Class<?> rightType = typeOf(right);
    if (leftType.equals(rightType)) {
      @SuppressWarnings("unchecked")
      Comparable<Object> comparable = (Comparable<Object>) left;
      return comparable.compareTo(right);
    }
    if (left instanceof Number && right instanceof Number) {
      Number leftNumber = (Number) left;
      Number rightNumber = (Number) right;
      if (isNonFinite(leftNumber) || isNonFinite(rightNumber)) {
        return Double.compare(leftNumber.doubleValue(), rightNumber.doubleValue());
      }
      return toBigDecimal(leftNumber).compareTo(toBigDecimal(rightNumber));
    }
    throw new IllegalArgumentException(
        String.format(
            "Cannot compare %s with %s", leftType.getSimpleName(), rightType.getSimpleName()));
  }

  private static boolean isNonFinite(Number number) {
    return (number instanceof Double || number instanceof Float)
        && !Double.isFinite(number.doubleValue());
  }

  private static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof BigInteger) {
      return new BigDecimal((BigInteger) number);
    }
    if (number instanceof Double || number instanceof Float) {
      return BigDecimal.valueOf(number.doubleValue());
    }
    return BigDecimal.valueOf(number.longValue());
  }

  private Values() {}
}
