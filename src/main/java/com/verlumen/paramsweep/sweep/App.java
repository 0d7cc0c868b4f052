package com.verlumen.paramsweep.sweep;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.paramsweep.backtesting.BacktestMetrics;
import com.verlumen.paramsweep.backtesting.BacktestingModule;
import com.verlumen.paramsweep.backtesting.Candle;
import com.verlumen.paramsweep.backtesting.CandleCsvReader;
import com.verlumen.paramsweep.backtesting.MovingAverageBinding;
import com.verlumen.paramsweep.backtesting.MovingAverageCrossoverEvaluator;
import com.verlumen.paramsweep.constraints.RelationalOperator;
import com.verlumen.paramsweep.execution.CancellationToken;
import com.verlumen.paramsweep.execution.SweepResult;
import com.verlumen.paramsweep.generation.SamplingPlan;
import com.verlumen.paramsweep.generation.SweepSpace;
import com.verlumen.paramsweep.store.FileResultStore;
import com.verlumen.paramsweep.store.ResultStore;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command-line entry point. Sweeps the fast and slow periods of a moving-average crossover over
 * candles read from a CSV file and logs one line per evaluated combination.
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String FAST_PERIOD = "nFast";
  private static final String SLOW_PERIOD = "nSlow";
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter RANGE_SPLITTER = Splitter.on("..").trimResults();
  private static final Duration SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

  private final SweepRunner sweepRunner;
  private final MovingAverageCrossoverEvaluator.Factory evaluatorFactory;
  private final CancellationToken cancellation = CancellationToken.create();
  private final CountDownLatch finished = new CountDownLatch(1);

  @Inject
  App(SweepRunner sweepRunner, MovingAverageCrossoverEvaluator.Factory evaluatorFactory) {
    this.sweepRunner = sweepRunner;
    this.evaluatorFactory = evaluatorFactory;
  }

  SweepOutcome<BacktestMetrics> run(
      Sweep sweep, ImmutableList<Candle> candles, ResultStore<BacktestMetrics> store)
      throws IOException {
    try {
      MovingAverageCrossoverEvaluator evaluator =
          evaluatorFactory.create(candles, sweep.space().distributions());
      SweepOutcome<BacktestMetrics> outcome =
          sweepRunner.run(sweep, evaluator, store, cancellation);
      logResults(outcome);
      return outcome;
    } finally {
      finished.countDown();
    }
  }

  /**
   * Cancels the sweep and waits for {@link #run} to return, so that workers can finish the
   * combination they are evaluating.
   *
   * @return whether {@code run} returned within {@code gracePeriod}
   */
  boolean cancelAndAwait(Duration gracePeriod) {
    cancellation.cancel();
    return Uninterruptibles.awaitUninterruptibly(finished, gracePeriod);
  }

  public static void main(String[] args) {
    ArgumentParser parser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(1);
      return;
    }

    SweepSpace space = SweepSpace.create();
    ImmutableList<Integer> fastPeriods = parseValues(namespace.getString("fastPeriods"));
    ImmutableList<Integer> slowPeriods = parseValues(namespace.getString("slowPeriods"));
    space.declare(FAST_PERIOD, MovingAverageBinding.FAST_PERIOD, fastPeriods);
    space.declare(SLOW_PERIOD, MovingAverageBinding.SLOW_PERIOD, slowPeriods);
    space.declareConstraint(
        "fastBelowSlow", FAST_PERIOD, SLOW_PERIOD, RelationalOperator.LESS_THAN);

    SweepSettings.Builder settings = SweepSettings.builder()
        .setSampleCount(namespace.getInt("sampleCount"))
        .setSeed(namespace.getLong("seed"))
        .setWorkerPoolSize(namespace.getInt("workers"));
    Integer timeoutSeconds = namespace.getInt("timeoutSeconds");
    if (timeoutSeconds != null) {
      settings.setEvaluationTimeout(Duration.ofSeconds(timeoutSeconds));
    }
    Sweep sweep = Sweep.create(namespace.getString("strategyName"), space, settings.build());

    ImmutableList<Candle> candles;
    try {
      candles = CandleCsvReader.read(Paths.get(namespace.getString("candles")));
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Cannot read candles");
      throw new RuntimeException("Cannot read candles", e);
    }

    App app = Guice.createInjector(SweepModule.create(), BacktestingModule.create())
        .getInstance(App.class);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.atInfo().log("Shutdown hook triggered, cancelling sweep");
                  if (!app.cancelAndAwait(SHUTDOWN_GRACE_PERIOD)) {
                    logger.atWarning().log(
                        "Sweep did not stop within %s", SHUTDOWN_GRACE_PERIOD);
                  }
                }));

    try {
      Path resultsDir = Paths.get(namespace.getString("resultsDir"));
      app.run(sweep, candles, FileResultStore.create(resultsDir, BacktestMetrics.class));
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Parameter sweep failed");
      throw new RuntimeException("Parameter sweep failed", e);
    }
  }

  /**
   * Parses integer candidates written as a comma-separated list ({@code 5,10,20}) or an inclusive
   * range with an optional step ({@code 5..50} or {@code 5..50..5}).
   */
  static ImmutableList<Integer> parseValues(String text) {
    checkArgument(text != null && !text.isBlank(), "No values given");
    if (!text.contains("..")) {
      return LIST_SPLITTER.splitToStream(text)
          .map(Integer::valueOf)
          .collect(ImmutableList.toImmutableList());
    }

    List<String> parts = RANGE_SPLITTER.splitToList(text);
    checkArgument(parts.size() == 2 || parts.size() == 3, "Malformed range: %s", text);
    int start = Integer.parseInt(parts.get(0));
    int end = Integer.parseInt(parts.get(1));
    int step = parts.size() == 3 ? Integer.parseInt(parts.get(2)) : 1;
    checkArgument(start <= end, "Range start %s is after its end %s", start, end);
    checkArgument(step > 0, "Range step must be positive: %s", step);
    return ContiguousSet.create(Range.closed(start, end), DiscreteDomain.integers()).stream()
        .filter(value -> (value - start) % step == 0)
        .collect(ImmutableList.toImmutableList());
  }

  private static void logResults(SweepOutcome<BacktestMetrics> outcome) {
    logger.atInfo().log(
        "Results for %s (%s%s):",
        outcome.identity(),
        outcome.resultSet().status(),
        outcome.loadedFromStore() ? ", loaded from store" : "");
    for (SweepResult<BacktestMetrics> result : outcome.resultSet().results()) {
      if (result.isSuccess()) {
        BacktestMetrics metrics = result.output().get();
        logger.atInfo().log(
            "%s return=%.4f trades=%d winRate=%.2f maxDrawdown=%.4f profitFactor=%.2f",
            result.combination(), metrics.cumulativeReturn(), metrics.numberOfTrades(),
            metrics.winRate(), metrics.maxDrawdown(), metrics.profitFactor());
      } else {
        logger.atInfo().log("%s FAILED %s", result.combination(), result.errorDetail().get());
      }
    }
    outcome.resultSet().results().stream()
        .filter(SweepResult::isSuccess)
        .max(Comparator.comparingDouble(result -> result.output().get().cumulativeReturn()))
        .ifPresent(best -> logger.atInfo().log(
            "Best combination %s with return %.4f",
            best.combination(), best.output().get().cumulativeReturn()));
  }

  private static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("ParamSweep")
            .build()
            .defaultHelp(true)
            .description("Sweeps the periods of a moving-average crossover strategy");

    parser.addArgument("--candles")
        .type(String.class)
        .required(true)
        .help("CSV file of timestamp,open,high,low,close,volume candles");

    parser.addArgument("--strategyName")
        .type(String.class)
        .setDefault("SMA_CROSSOVER")
        .help("Name the sweep results are stored under");

    parser.addArgument("--fastPeriods")
        .type(String.class)
        .setDefault("5..50..5")
        .help("Fast SMA periods, as a list (5,10) or an inclusive range (5..50 or 5..50..5)");

    parser.addArgument("--slowPeriods")
        .type(String.class)
        .setDefault("20..200..10")
        .help("Slow SMA periods, as a list (20,50) or an inclusive range (20..200..10)");

    parser.addArgument("--sampleCount")
        .type(Integer.class)
        .setDefault(0)
        .help("Number of combinations to sample; 0 evaluates all of them");

    parser.addArgument("--seed")
        .type(Long.class)
        .setDefault(SamplingPlan.DEFAULT_SEED)
        .help("Random seed used for sampling");

    parser.addArgument("--workers")
        .type(Integer.class)
        .setDefault(SweepSettings.defaultWorkerPoolSize())
        .help("Number of worker threads; 1 evaluates sequentially");

    parser.addArgument("--timeoutSeconds")
        .type(Integer.class)
        .help("Optional ceiling on a single evaluation, in seconds");

    parser.addArgument("--resultsDir")
        .type(String.class)
        .setDefault("sweep-results")
        .help("Directory holding stored sweep results");

    return parser;
  }
}
