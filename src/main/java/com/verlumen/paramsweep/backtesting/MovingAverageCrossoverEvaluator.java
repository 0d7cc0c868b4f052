package com.verlumen.paramsweep.backtesting;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.paramsweep.execution.EvaluationException;
import com.verlumen.paramsweep.execution.Evaluator;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.params.DistributionTable;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseStrategy;
import org.ta4j.core.BaseTradingRecord;
import org.ta4j.core.Position;
import org.ta4j.core.Strategy;
import org.ta4j.core.TradingRecord;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;
import org.ta4j.core.rules.CrossedDownIndicatorRule;
import org.ta4j.core.rules.CrossedUpIndicatorRule;

/**
 * Backtests a simple moving-average crossover: enter when the fast average crosses above the slow
 * one, exit when it crosses back below.
 *
 * <p>The bar series is built once and only read afterwards. Every evaluation creates its own
 * indicators, strategy and trading record, so evaluations may run concurrently.
 */
public final class MovingAverageCrossoverEvaluator implements Evaluator<BacktestMetrics> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public interface Factory {
    /**
     * Creates an evaluator over {@code candles}. Its periods are read from the distributions bound
     * to {@link MovingAverageBinding#FAST_PERIOD} and {@link MovingAverageBinding#SLOW_PERIOD}.
     */
    MovingAverageCrossoverEvaluator create(
        ImmutableList<Candle> candles, DistributionTable distributions);
  }

  private final BarSeries series;
  private final String fastLabel;
  private final String slowLabel;

  @Inject
  MovingAverageCrossoverEvaluator(
      BarSeriesFactory barSeriesFactory,
      @Assisted ImmutableList<Candle> candles,
      @Assisted DistributionTable distributions) {
    checkArgument(!candles.isEmpty(), "Cannot backtest without candles");
    this.series = barSeriesFactory.createBarSeries(candles);
    this.fastLabel = distributions.labelFor(MovingAverageBinding.FAST_PERIOD);
    this.slowLabel = distributions.labelFor(MovingAverageBinding.SLOW_PERIOD);
  }

  @Override
  public BacktestMetrics evaluate(Combination combination) throws EvaluationException {
    int fastPeriod = period(combination, fastLabel);
    int slowPeriod = period(combination, slowLabel);

    Strategy strategy = createStrategy(fastPeriod, slowPeriod);
    TradingRecord tradingRecord = runStrategy(strategy);
    BacktestMetrics metrics = computeMetrics(tradingRecord);
    logger.atFine().log("Crossover %d/%d: %s", fastPeriod, slowPeriod, metrics);
    return metrics;
  }

  private static int period(Combination combination, String label) throws EvaluationException {
    int period;
    try {
      period = combination.getInt(label);
    } catch (IllegalArgumentException e) {
      throw new EvaluationException("Invalid moving average period for " + label, e);
    }
    if (period <= 0) {
      throw new EvaluationException(
          String.format("Moving average period %s must be positive, got %d", label, period));
    }
    return period;
  }

  private Strategy createStrategy(int fastPeriod, int slowPeriod) {
    ClosePriceIndicator closePrice = new ClosePriceIndicator(series);
    SMAIndicator fastSma = new SMAIndicator(closePrice, fastPeriod);
    SMAIndicator slowSma = new SMAIndicator(closePrice, slowPeriod);
    return new BaseStrategy(
        String.format("SMA crossover %d/%d", fastPeriod, slowPeriod),
        new CrossedUpIndicatorRule(fastSma, slowSma),
        new CrossedDownIndicatorRule(fastSma, slowSma),
        Math.max(fastPeriod, slowPeriod));
  }

  private TradingRecord runStrategy(Strategy strategy) {
    TradingRecord tradingRecord = new BaseTradingRecord();
    Num amount = series.numOf(1);
    for (int i = series.getBeginIndex(); i <= series.getEndIndex(); i++) {
      Num closePrice = series.getBar(i).getClosePrice();
      if (tradingRecord.getCurrentPosition().isNew() && strategy.shouldEnter(i, tradingRecord)) {
        tradingRecord.enter(i, closePrice, amount);
      } else if (tradingRecord.getCurrentPosition().isOpened()
          && strategy.shouldExit(i, tradingRecord)) {
        tradingRecord.exit(i, closePrice, amount);
      }
    }
    return tradingRecord;
  }

  /**
   * Metrics over closed positions; a position still open at the last bar is ignored.
   *
   * @throws EvaluationException if a closed position was entered at a non-positive price
   */
  static BacktestMetrics computeMetrics(TradingRecord tradingRecord) throws EvaluationException {
    int trades = 0;
    int wins = 0;
    double equity = 1.0;
    double peak = 1.0;
    double maxDrawdown = 0.0;
    double grossProfit = 0.0;
    double grossLoss = 0.0;

    for (Position position : tradingRecord.getPositions()) {
      if (!position.isClosed()) {
        continue;
      }
      double entry = position.getEntry().getNetPrice().doubleValue();
      double exit = position.getExit().getNetPrice().doubleValue();
      if (entry <= 0.0) {
        throw new EvaluationException(
            "Cannot compute a return for a position entered at price " + entry);
      }
      double positionReturn = exit / entry - 1.0;

      trades++;
      if (positionReturn > 0) {
        wins++;
        grossProfit += positionReturn;
      } else {
        grossLoss -= positionReturn;
      }

      equity *= 1.0 + positionReturn;
      peak = Math.max(peak, equity);
      maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak);
    }

    double winRate = trades == 0 ? 0.0 : (double) wins / trades;
    double profitFactor = grossLoss == 0.0 ? grossProfit : grossProfit / grossLoss;
    return new BacktestMetrics(equity - 1.0, trades, winRate, maxDrawdown, profitFactor);
  }
}
