package com.verlumen.paramsweep.backtesting;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.time.ZoneOffset;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;

final class BarSeriesBuilder {
  private static final Duration DEFAULT_BAR_DURATION = Duration.ofMinutes(1);

  static BarSeries createBarSeries(ImmutableList<Candle> candles) {
    checkArgument(!candles.isEmpty(), "Bar series cannot be empty");
    BarSeries series = new BaseBarSeriesBuilder()
        .withName("candleSeries")
        .build();

    Duration barDuration = barDuration(candles);
    candles.forEach(candle -> series.addBar(
        barDuration,
        candle.timestamp().atZone(ZoneOffset.UTC),
        candle.open(),
        candle.high(),
        candle.low(),
        candle.close(),
        candle.volume()));
    return series;
  }

  /** Spacing of the first two candles, or one minute for a single candle. */
  private static Duration barDuration(ImmutableList<Candle> candles) {
    if (candles.size() < 2) {
      return DEFAULT_BAR_DURATION;
    }
    Duration spacing = Duration.between(candles.get(0).timestamp(), candles.get(1).timestamp());
    return spacing.isNegative() || spacing.isZero() ? DEFAULT_BAR_DURATION : spacing;
  }

  private BarSeriesBuilder() {}
}
