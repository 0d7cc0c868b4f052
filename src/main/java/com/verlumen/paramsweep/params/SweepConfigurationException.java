package com.verlumen.paramsweep.params;

/**
 * Thrown when a sweep is declared incorrectly: unknown or duplicate labels, empty candidate sets,
 * unsupported operators and similar mistakes. Always raised before any combination is generated.
 */
public final class SweepConfigurationException extends IllegalArgumentException {
  public SweepConfigurationException(String message) {
    super(message);
  }

  public static void checkConfiguration(boolean condition, String template, Object... args) {
    if (!condition) {
      throw new SweepConfigurationException(String.format(template, args));
    }
  }
}
