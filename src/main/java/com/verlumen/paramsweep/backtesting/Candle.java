package com.verlumen.paramsweep.backtesting;

import com.google.auto.value.AutoValue;
import java.time.Instant;

/** One OHLCV bar of market data. */
@AutoValue
public abstract class Candle {
  /** End of the bar. */
  public abstract Instant timestamp();

  public abstract double open();

  public abstract double high();

  public abstract double low();

  public abstract double close();

  public abstract double volume();

  public static Candle create(
      Instant timestamp, double open, double high, double low, double close, double volume) {
    return new AutoValue_Candle(timestamp, open, high, low, close, volume);
  }
}
