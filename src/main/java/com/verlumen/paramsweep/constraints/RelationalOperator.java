package com.verlumen.paramsweep.constraints;

import com.google.common.collect.ImmutableMap;
import com.verlumen.paramsweep.params.SweepConfigurationException;

/** The relations a constraint can require between two distributions. */
public enum RelationalOperator {
  LESS_THAN("<") {
    @Override
    boolean test(int comparison) {
      return comparison < 0;
    }
  },
  LESS_THAN_OR_EQUAL("<=") {
    @Override
    boolean test(int comparison) {
      return comparison <= 0;
    }
  },
  GREATER_THAN(">") {
    @Override
    boolean test(int comparison) {
      return comparison > 0;
    }
  },
  GREATER_THAN_OR_EQUAL(">=") {
    @Override
    boolean test(int comparison) {
      return comparison >= 0;
    }
  },
  EQUAL("=") {
    @Override
    boolean test(int comparison) {
      return comparison == 0;
    }
  };

  private static final ImmutableMap<String, RelationalOperator> BY_SYMBOL =
      ImmutableMap.<String, RelationalOperator>builder()
          .put("<", LESS_THAN)
          .put("<=", LESS_THAN_OR_EQUAL)
          .put("≤", LESS_THAN_OR_EQUAL)
          .put(">", GREATER_THAN)
          .put(">=", GREATER_THAN_OR_EQUAL)
          .put("≥", GREATER_THAN_OR_EQUAL)
          .put("=", EQUAL)
          .put("==", EQUAL)
          .build();

  private final String symbol;

  RelationalOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Applies the relation to the result of {@code left.compareTo(right)}. */
  abstract boolean test(int comparison);

  /**
   * Parses an operator symbol.
   *
   * @throws SweepConfigurationException if the symbol is not one of the supported relations
   */
  public static RelationalOperator fromSymbol(String symbol) {
    RelationalOperator operator = symbol == null ? null : BY_SYMBOL.get(symbol.trim());
    if (operator == null) {
      throw new SweepConfigurationException("Unsupported relational operator: " + symbol);
    }
    return operator;
  }
}
