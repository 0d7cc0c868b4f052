package com.verlumen.paramsweep.execution;

public enum SweepStatus {
  /** Every combination produced a success or failure result. */
  COMPLETE,
  /** The sweep was cancelled before every combination was evaluated. */
  INCOMPLETE,
  /** No combination satisfied the constraints, so nothing was evaluated. */
  NO_COMBINATIONS
}
