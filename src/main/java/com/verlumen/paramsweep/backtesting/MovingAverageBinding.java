package com.verlumen.paramsweep.backtesting;

import com.verlumen.paramsweep.params.BindingTarget;

/** Parameters of a moving-average crossover strategy that a sweep can bind. */
public enum MovingAverageBinding implements BindingTarget {
  /** Period of the fast simple moving average. */
  FAST_PERIOD,
  /** Period of the slow simple moving average. */
  SLOW_PERIOD
}
