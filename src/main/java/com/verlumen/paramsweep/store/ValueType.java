package com.verlumen.paramsweep.store;

import java.math.BigDecimal;
import java.util.function.Function;

/** Type tags for the combination values a stored result set can hold. */
enum ValueType {
  INTEGER(Integer.class, Integer::valueOf),
  LONG(Long.class, Long::valueOf),
  DOUBLE(Double.class, Double::valueOf),
  BIG_DECIMAL(BigDecimal.class, BigDecimal::new),
  STRING(String.class, value -> value),
  BOOLEAN(Boolean.class, Boolean::valueOf);

  private final Class<?> type;
  private final Function<String, Comparable<?>> parser;

  ValueType(Class<?> type, Function<String, Comparable<?>> parser) {
    this.type = type;
    this.parser = parser;
  }

  Comparable<?> parse(String text) {
    return parser.apply(text);
  }

  static ValueType of(Comparable<?> value) throws PersistenceException {
    for (ValueType valueType : values()) {
      if (valueType.type.equals(value.getClass())) {
        return valueType;
      }
    }
    throw new PersistenceException(
        "Cannot store combination values of type " + value.getClass().getName());
  }
}
