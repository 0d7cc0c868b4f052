package com.verlumen.paramsweep.generation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.paramsweep.constraints.RelationalOperator;
import com.verlumen.paramsweep.params.BindingTarget;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.params.SweepConfigurationException;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CombinationGeneratorImplTest {
  private enum Binding implements BindingTarget {
    FAST,
    SLOW,
    SIGNAL
  }

  @Inject private CombinationGeneratorImpl generator;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void generate_withoutConstraints_returnsFullProductInNestedLoopOrder() {
    // Arrange
    SweepSpace space = SweepSpace.create();
    space.declare("a", Binding.FAST, ImmutableList.of(1, 2));
    space.declare("b", Binding.SLOW, ImmutableList.of("x", "y", "z"));

    // Act
    ImmutableList<Combination> combinations = generator.generate(space, SamplingPlan.exhaustive());

    // Assert
    assertThat(combinations)
        .containsExactly(
            combination("a", 1, "b", "x"),
            combination("a", 1, "b", "y"),
            combination("a", 1, "b", "z"),
            combination("a", 2, "b", "x"),
            combination("a", 2, "b", "y"),
            combination("a", 2, "b", "z"))
        .inOrder();
  }

  @Test
  public void generate_fastBelowSlow_keepsOnlyValidCombinationsInOrder() {
    // Arrange
    SweepSpace space = SweepSpace.create();
    space.declare("nFast", Binding.FAST, ImmutableList.of(1, 2, 3));
    space.declare("nSlow", Binding.SLOW, ImmutableList.of(2, 3));
    space.declareConstraint("fastBelowSlow", "nFast", "nSlow", RelationalOperator.LESS_THAN);

    // Act
    ImmutableList<Combination> combinations = generator.generate(space, SamplingPlan.exhaustive());

    // Assert
    assertThat(combinations)
        .containsExactly(
            combination("nFast", 1, "nSlow", 2),
            combination("nFast", 1, "nSlow", 3),
            combination("nFast", 2, "nSlow", 3))
        .inOrder();
  }

  @Test
  public void generate_integerBelowInfiniteDouble_keepsInfiniteCandidate() {
    // Arrange
    SweepSpace space = SweepSpace.create();
    space.declare("a", Binding.FAST, ImmutableList.of(1, 2));
    space.declare("b", Binding.SLOW, ImmutableList.of(1.5, Double.POSITIVE_INFINITY));
    space.declareConstraint("aBelowB", "a", "b", RelationalOperator.LESS_THAN);

    // Act
    ImmutableList<Combination> combinations = generator.generate(space, SamplingPlan.exhaustive());

    // Assert
    assertThat(combinations)
        .containsExactly(
            combination("a", 1, "b", 1.5),
            combination("a", 1, "b", Double.POSITIVE_INFINITY),
            combination("a", 2, "b", Double.POSITIVE_INFINITY))
        .inOrder();
  }

  @Test
  public void generate_matchesFilteredCartesianProduct() {
    // Arrange
    SweepSpace space = SweepSpace.create();
    space.declare("nFast", Binding.FAST, periods(1, 12));
    space.declare("nSlow", Binding.SLOW, periods(5, 20));
    space.declare("nSignal", Binding.SIGNAL, periods(1, 6));
    space.declareConstraint("fastBelowSlow", "nFast", "nSlow", RelationalOperator.LESS_THAN);
    space.declareConstraint("signalAtMostFast", "nSignal", "nFast", "<=");

    ImmutableList.Builder<Combination> expected = ImmutableList.builder();
    for (int fast = 1; fast <= 12; fast++) {
      for (int slow = 5; slow <= 20; slow++) {
        for (int signal = 1; signal <= 6; signal++) {
          if (fast < slow && signal <= fast) {
            expected.add(Combination.of(
                ImmutableMap.of("nFast", fast, "nSlow", slow, "nSignal", signal)));
          }
        }
      }
    }

    // Act
    ImmutableList<Combination> combinations = generator.generate(space, SamplingPlan.exhaustive());

    // Assert
    assertThat(combinations).containsExactlyElementsIn(expected.build()).inOrder();
    assertThat(generator.count(space)).isEqualTo(combinations.size());
  }

  @Test
  public void generate_constraintOnLaterDistributions_prunesWithoutLosingValidOnes() {
    // Arrange
    SweepSpace space = SweepSpace.create();
    space.declare("nSignal", Binding.SIGNAL, ImmutableList.of(1, 2));
    space.declare("nFast", Binding.FAST, ImmutableList.of(1, 2, 3));
    space.declare("nSlow", Binding.SLOW, ImmutableList.of(2, 3));
    space.declareConstraint("slowAboveFast", "nSlow", "nFast", RelationalOperator.GREATER_THAN);

    // Act
    ImmutableList<Combination> combinations = generator.generate(space, SamplingPlan.exhaustive());

    // Assert
    assertThat(combinations).hasSize(6);
    assertThat(combinations.get(0))
        .isEqualTo(Combination.of(ImmutableMap.of("nSignal", 1, "nFast", 1, "nSlow", 2)));
    assertThat(combinations.get(5))
        .isEqualTo(Combination.of(ImmutableMap.of("nSignal", 2, "nFast", 2, "nSlow", 3)));
  }

  @Test
  public void generate_unsatisfiableConstraints_returnsEmptyList() {
    // Arrange
    SweepSpace space = SweepSpace.create();
    space.declare("nFast", Binding.FAST, ImmutableList.of(10, 20));
    space.declare("nSlow", Binding.SLOW, ImmutableList.of(1, 2));
    space.declareConstraint("fastBelowSlow", "nFast", "nSlow", RelationalOperator.LESS_THAN);

    // Act
    ImmutableList<Combination> combinations = generator.generate(space, SamplingPlan.sampled(5));

    // Assert
    assertThat(combinations).isEmpty();
  }

  @Test
  public void generate_withoutDistributions_throwsConfigurationException() {
    SweepConfigurationException thrown = assertThrows(SweepConfigurationException.class,
        () -> generator.generate(SweepSpace.create(), SamplingPlan.exhaustive()));

    assertThat(thrown).hasMessageThat().contains("at least one distribution");
  }

  @Test
  public void generate_sampleCountAtLeastValidCount_returnsAllUnchanged() {
    // Arrange
    SweepSpace space = fastSlowSpace();
    ImmutableList<Combination> all = generator.generate(space, SamplingPlan.exhaustive());

    // Act
    ImmutableList<Combination> sampled =
        generator.generate(space, SamplingPlan.create(all.size(), 7L));
    ImmutableList<Combination> oversampled =
        generator.generate(space, SamplingPlan.create(all.size() + 100, 7L));

    // Assert
    assertThat(sampled).containsExactlyElementsIn(all).inOrder();
    assertThat(oversampled).containsExactlyElementsIn(all).inOrder();
  }

  @Test
  public void generate_sampleCountBelowValidCount_returnsDistinctSubsetInGenerationOrder() {
    // Arrange
    SweepSpace space = fastSlowSpace();
    ImmutableList<Combination> all = generator.generate(space, SamplingPlan.exhaustive());

    // Act
    ImmutableList<Combination> sampled = generator.generate(space, SamplingPlan.sampled(10));

    // Assert
    assertThat(sampled).hasSize(10);
    assertThat(sampled).containsNoDuplicates();
    assertThat(all).containsAtLeastElementsIn(sampled).inOrder();
  }

  @Test
  public void generate_sameSeed_isReproducible() {
    // Arrange
    SweepSpace space = fastSlowSpace();

    // Act
    ImmutableList<Combination> first = generator.generate(space, SamplingPlan.create(15, 1234L));
    ImmutableList<Combination> second = generator.generate(space, SamplingPlan.create(15, 1234L));

    // Assert
    assertThat(second).containsExactlyElementsIn(first).inOrder();
  }

  @Test
  public void samplingPlan_negativeCount_throwsConfigurationException() {
    assertThrows(SweepConfigurationException.class, () -> SamplingPlan.sampled(-1));
  }

  private static SweepSpace fastSlowSpace() {
    SweepSpace space = SweepSpace.create();
    space.declare("nFast", Binding.FAST, periods(1, 20));
    space.declare("nSlow", Binding.SLOW, periods(2, 30));
    space.declareConstraint("fastBelowSlow", "nFast", "nSlow", RelationalOperator.LESS_THAN);
    return space;
  }

  private static ImmutableList<Integer> periods(int from, int to) {
    return ImmutableList.copyOf(
        ContiguousSet.create(Range.closed(from, to), DiscreteDomain.integers()));
  }

  private static Combination combination(String k1, Comparable<?> v1, String k2, Comparable<?> v2) {
    return Combination.of(ImmutableMap.of(k1, v1, k2, v2));
  }
}
