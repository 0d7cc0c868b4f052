package com.verlumen.paramsweep.sweep;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.paramsweep.constraints.RelationalOperator;
import com.verlumen.paramsweep.execution.CancellationToken;
import com.verlumen.paramsweep.execution.Evaluator;
import com.verlumen.paramsweep.execution.ResultSet;
import com.verlumen.paramsweep.execution.SweepResult;
import com.verlumen.paramsweep.execution.SweepScheduler;
import com.verlumen.paramsweep.execution.SweepStatus;
import com.verlumen.paramsweep.generation.CombinationGenerator;
import com.verlumen.paramsweep.generation.SweepSpace;
import com.verlumen.paramsweep.params.BindingTarget;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.store.PersistenceException;
import com.verlumen.paramsweep.store.ResultStore;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class SweepRunnerImplTest {
  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  private enum Binding implements BindingTarget {
    FAST,
    SLOW
  }

  private static final Combination FIRST = Combination.of(ImmutableMap.of("nFast", 1, "nSlow", 2));
  private static final Combination SECOND = Combination.of(ImmutableMap.of("nFast", 1, "nSlow", 3));

  @Bind @Mock private CombinationGenerator mockCombinationGenerator;
  @Bind @Mock private SweepScheduler mockSweepScheduler;
  @Mock private Evaluator<Integer> mockEvaluator;
  @Mock private ResultStore<Integer> mockStore;

  @Inject private SweepRunnerImpl sweepRunner;

  private Sweep sweep;
  private CancellationToken cancellation;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);

    SweepSpace space = SweepSpace.create();
    space.declare("nFast", Binding.FAST, ImmutableList.of(1, 2));
    space.declare("nSlow", Binding.SLOW, ImmutableList.of(2, 3));
    space.declareConstraint("fastBelowSlow", "nFast", "nSlow", RelationalOperator.LESS_THAN);
    sweep = Sweep.create("SMA", space, SweepSettings.builder().setWorkerPoolSize(1).build());
    cancellation = CancellationToken.create();
  }

  @Test
  public void run_storedResultsPresent_returnsThemWithoutEvaluating() throws Exception {
    // Arrange
    ResultSet<Integer> stored = complete(SweepResult.succeeded(FIRST, 3));
    when(mockStore.load(sweep.identity())).thenReturn(Optional.of(stored));

    // Act
    SweepOutcome<Integer> outcome = sweepRunner.run(sweep, mockEvaluator, mockStore, cancellation);

    // Assert
    assertThat(outcome.loadedFromStore()).isTrue();
    assertThat(outcome.resultSet()).isSameInstanceAs(stored);
    assertThat(outcome.identity()).isEqualTo(sweep.identity());
    verifyNoInteractions(mockCombinationGenerator, mockSweepScheduler, mockEvaluator);
    verify(mockStore, never()).save(any(), any());
  }

  @Test
  public void run_nothingStored_generatesSchedulesAndSaves() throws Exception {
    // Arrange
    ImmutableList<Combination> combinations = ImmutableList.of(FIRST, SECOND);
    ResultSet<Integer> resultSet =
        complete(SweepResult.succeeded(FIRST, 3), SweepResult.succeeded(SECOND, 4));
    when(mockStore.load(sweep.identity())).thenReturn(Optional.empty());
    when(mockCombinationGenerator.generate(sweep.space(), sweep.settings().samplingPlan()))
        .thenReturn(combinations);
    when(mockSweepScheduler.schedule(
            combinations, mockEvaluator, sweep.settings().schedulerSettings(), cancellation))
        .thenReturn(resultSet);

    // Act
    SweepOutcome<Integer> outcome = sweepRunner.run(sweep, mockEvaluator, mockStore, cancellation);

    // Assert
    assertThat(outcome.loadedFromStore()).isFalse();
    assertThat(outcome.resultSet()).isSameInstanceAs(resultSet);
    verify(mockStore).save(sweep.identity(), resultSet);
  }

  @Test
  public void run_incompleteSweep_isNotSaved() throws Exception {
    // Arrange
    ImmutableList<Combination> combinations = ImmutableList.of(FIRST, SECOND);
    ResultSet<Integer> partial = ResultSet.create(
        SweepStatus.INCOMPLETE, 2, ImmutableList.of(SweepResult.succeeded(FIRST, 3)));
    when(mockStore.load(sweep.identity())).thenReturn(Optional.empty());
    when(mockCombinationGenerator.generate(sweep.space(), sweep.settings().samplingPlan()))
        .thenReturn(combinations);
    when(mockSweepScheduler.schedule(
            combinations, mockEvaluator, sweep.settings().schedulerSettings(), cancellation))
        .thenReturn(partial);

    // Act
    SweepOutcome<Integer> outcome = sweepRunner.run(sweep, mockEvaluator, mockStore, cancellation);

    // Assert
    assertThat(outcome.resultSet().status()).isEqualTo(SweepStatus.INCOMPLETE);
    verify(mockStore, never()).save(any(), any());
  }

  @Test
  public void run_noCombinations_isSaved() throws Exception {
    // Arrange
    ResultSet<Integer> empty = ResultSet.noCombinations();
    when(mockStore.load(sweep.identity())).thenReturn(Optional.empty());
    when(mockCombinationGenerator.generate(sweep.space(), sweep.settings().samplingPlan()))
        .thenReturn(ImmutableList.of());
    when(mockSweepScheduler.schedule(
            ImmutableList.of(), mockEvaluator, sweep.settings().schedulerSettings(), cancellation))
        .thenReturn(empty);

    // Act
    sweepRunner.run(sweep, mockEvaluator, mockStore, cancellation);

    // Assert
    verify(mockStore).save(sweep.identity(), empty);
  }

  @Test
  public void run_storeFailsToLoad_propagatesPersistenceException() throws Exception {
    // Arrange
    when(mockStore.load(sweep.identity())).thenThrow(new PersistenceException("disk gone"));

    // Act
    PersistenceException thrown = assertThrows(PersistenceException.class,
        () -> sweepRunner.run(sweep, mockEvaluator, mockStore, cancellation));

    // Assert
    assertThat(thrown).hasMessageThat().isEqualTo("disk gone");
    verifyNoInteractions(mockCombinationGenerator, mockSweepScheduler);
  }

  @SafeVarargs
  private static ResultSet<Integer> complete(SweepResult<Integer>... results) {
    return ResultSet.create(SweepStatus.COMPLETE, results.length, ImmutableList.copyOf(results));
  }
}
