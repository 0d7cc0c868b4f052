package com.verlumen.paramsweep.execution;

public enum ExecutionMode {
  SEQUENTIAL,
  PARALLEL;

  /** Worker-pool sizes of zero or one run on the calling thread. */
  public static ExecutionMode forWorkerPoolSize(int workerPoolSize) {
    return workerPoolSize > 1 ? PARALLEL : SEQUENTIAL;
  }
}
