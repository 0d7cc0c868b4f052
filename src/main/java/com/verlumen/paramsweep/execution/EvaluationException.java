package com.verlumen.paramsweep.execution;

/** Raised by an {@link Evaluator} when a single combination cannot be evaluated. */
public class EvaluationException extends Exception {
  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
