package com.verlumen.paramsweep.backtesting;

import com.google.common.collect.ImmutableList;
import org.ta4j.core.BarSeries;

/**
 * Factory interface for creating {@link BarSeries} instances from market data candles.
 *
 * <p>Implementations may assume the candles are sorted in chronological order.
 */
public interface BarSeriesFactory {
  /**
   * Creates a {@link BarSeries} from an immutable list of {@link Candle} objects.
   *
   * @throws IllegalArgumentException if the candles list is empty
   */
  BarSeries createBarSeries(ImmutableList<Candle> candles);
}
