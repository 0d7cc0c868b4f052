package com.verlumen.paramsweep.store;

import java.io.IOException;

/** Raised when a result set cannot be loaded from or saved to a {@link ResultStore}. */
public final class PersistenceException extends IOException {
  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
