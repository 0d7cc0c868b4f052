package com.verlumen.paramsweep.backtesting;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.paramsweep.execution.EvaluationException;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.params.DistributionTable;
import com.verlumen.paramsweep.params.SweepConfigurationException;
import java.time.Instant;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.ta4j.core.BaseTradingRecord;
import org.ta4j.core.TradingRecord;
import org.ta4j.core.num.DecimalNum;

@RunWith(JUnit4.class)
public class MovingAverageCrossoverEvaluatorTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  @Inject private MovingAverageCrossoverEvaluator.Factory evaluatorFactory;

  private DistributionTable distributions;

  @Before
  public void setUp() {
    Guice.createInjector(BacktestingModule.create()).injectMembers(this);
    distributions = new DistributionTable();
    distributions.declare("nFast", MovingAverageBinding.FAST_PERIOD, ImmutableList.of(2));
    distributions.declare("nSlow", MovingAverageBinding.SLOW_PERIOD, ImmutableList.of(5));
  }

  @Test
  public void evaluate_riseThenFall_closesOneWinningTrade() throws Exception {
    // Arrange: down 2.5 per bar to 100, up 2.5 per bar to 150, then down again to 100.
    ImmutableList.Builder<Double> closes = ImmutableList.builder();
    for (int i = 0; i < 10; i++) {
      closes.add(122.5 - 2.5 * i);
    }
    for (int i = 1; i <= 20; i++) {
      closes.add(100.0 + 2.5 * i);
    }
    for (int i = 1; i <= 20; i++) {
      closes.add(150.0 - 2.5 * i);
    }
    MovingAverageCrossoverEvaluator evaluator =
        evaluatorFactory.create(candles(closes.build()), distributions);

    // Act
    BacktestMetrics metrics = evaluator.evaluate(periods(2, 5));

    // Assert: entry on the second rising bar at 105, exit two bars after the peak at 145.
    assertThat(metrics.numberOfTrades()).isEqualTo(1);
    assertThat(metrics.winRate()).isEqualTo(1.0);
    assertThat(metrics.cumulativeReturn()).isWithin(1e-9).of(145.0 / 105.0 - 1.0);
    assertThat(metrics.maxDrawdown()).isEqualTo(0.0);
    assertThat(metrics.profitFactor()).isWithin(1e-9).of(145.0 / 105.0 - 1.0);
  }

  @Test
  public void evaluate_flatPrices_producesNoTrades() throws Exception {
    MovingAverageCrossoverEvaluator evaluator =
        evaluatorFactory.create(candles(ImmutableList.of(100.0, 100.0, 100.0, 100.0, 100.0,
            100.0, 100.0, 100.0)), distributions);

    BacktestMetrics metrics = evaluator.evaluate(periods(2, 5));

    assertThat(metrics).isEqualTo(new BacktestMetrics(0.0, 0, 0.0, 0.0, 0.0));
  }

  @Test
  public void evaluate_nonPositivePeriod_throwsEvaluationException() {
    MovingAverageCrossoverEvaluator evaluator =
        evaluatorFactory.create(candles(ImmutableList.of(1.0, 2.0, 3.0)), distributions);

    EvaluationException thrown =
        assertThrows(EvaluationException.class, () -> evaluator.evaluate(periods(0, 5)));

    assertThat(thrown).hasMessageThat().contains("must be positive");
  }

  @Test
  public void evaluate_nonIntegerPeriod_throwsEvaluationException() {
    MovingAverageCrossoverEvaluator evaluator =
        evaluatorFactory.create(candles(ImmutableList.of(1.0, 2.0, 3.0)), distributions);

    assertThrows(EvaluationException.class,
        () -> evaluator.evaluate(
            Combination.of(ImmutableMap.of("nFast", "two", "nSlow", 5))));
  }

  @Test
  public void constructor_unboundSlowPeriod_throwsConfigurationException() {
    DistributionTable fastOnly = new DistributionTable();
    fastOnly.declare("nFast", MovingAverageBinding.FAST_PERIOD, ImmutableList.of(2));

    assertThrows(SweepConfigurationException.class,
        () -> new MovingAverageCrossoverEvaluator(
            BarSeriesBuilder::createBarSeries, candles(ImmutableList.of(1.0, 2.0)), fastOnly));
  }

  @Test
  public void evaluator_isReentrant() {
    MovingAverageCrossoverEvaluator evaluator =
        evaluatorFactory.create(candles(ImmutableList.of(1.0, 2.0)), distributions);

    assertThat(evaluator.isReentrant()).isTrue();
  }

  @Test
  public void computeMetrics_mixedTrades() throws Exception {
    // Arrange: +10% then -10%.
    TradingRecord tradingRecord = new BaseTradingRecord();
    tradingRecord.enter(0, DecimalNum.valueOf(100), DecimalNum.valueOf(1));
    tradingRecord.exit(1, DecimalNum.valueOf(110), DecimalNum.valueOf(1));
    tradingRecord.enter(2, DecimalNum.valueOf(110), DecimalNum.valueOf(1));
    tradingRecord.exit(3, DecimalNum.valueOf(99), DecimalNum.valueOf(1));

    // Act
    BacktestMetrics metrics = MovingAverageCrossoverEvaluator.computeMetrics(tradingRecord);

    // Assert
    assertThat(metrics.numberOfTrades()).isEqualTo(2);
    assertThat(metrics.winRate()).isEqualTo(0.5);
    assertThat(metrics.cumulativeReturn()).isWithin(1e-9).of(-0.01);
    assertThat(metrics.maxDrawdown()).isWithin(1e-9).of(0.1);
    assertThat(metrics.profitFactor()).isWithin(1e-9).of(1.0);
  }

  @Test
  public void computeMetrics_zeroEntryPrice_throwsEvaluationException() {
    TradingRecord tradingRecord = new BaseTradingRecord();
    tradingRecord.enter(0, DecimalNum.valueOf(0), DecimalNum.valueOf(1));
    tradingRecord.exit(1, DecimalNum.valueOf(10), DecimalNum.valueOf(1));

    assertThrows(
        EvaluationException.class,
        () -> MovingAverageCrossoverEvaluator.computeMetrics(tradingRecord));
  }

  private static Combination periods(int fast, int slow) {
    return Combination.of(ImmutableMap.of("nFast", fast, "nSlow", slow));
  }

  private static ImmutableList<Candle> candles(ImmutableList<Double> closes) {
    ImmutableList.Builder<Candle> candles = ImmutableList.builder();
    for (int i = 0; i < closes.size(); i++) {
      double close = closes.get(i);
      candles.add(Candle.create(START.plusSeconds(60L * i), close, close, close, close, 1));
    }
    return candles.build();
  }
}
