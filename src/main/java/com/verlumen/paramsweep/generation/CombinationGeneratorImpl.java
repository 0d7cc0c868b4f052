package com.verlumen.paramsweep.generation;

import static com.verlumen.paramsweep.params.SweepConfigurationException.checkConfiguration;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.LongMath;
import com.google.inject.Inject;
import com.verlumen.paramsweep.constraints.Constraint;
import com.verlumen.paramsweep.constraints.ConstraintSet;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.params.ParameterDistribution;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Depth-first implementation of {@link CombinationGenerator}.
 *
 * <p>Distributions are bound one at a time in declaration order. As soon as a constraint has both
 * of its distributions bound it is checked, and the whole subtree below a failing partial
 * assignment is skipped, so only surviving combinations are ever materialized.
 */
final class CombinationGeneratorImpl implements CombinationGenerator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  CombinationGeneratorImpl() {}

  @Override
  public ImmutableList<Combination> generate(SweepSpace space, SamplingPlan plan) {
    ImmutableList<Combination> valid = expand(space);
    ImmutableList<Combination> sampled = sample(valid, plan);
    logger.atInfo().log(
        "Generated %d valid combinations (full product %d), keeping %d",
        valid.size(), fullProductSize(space), sampled.size());
    return sampled;
  }

  @Override
  public int count(SweepSpace space) {
    return expand(space).size();
  }

  private ImmutableList<Combination> expand(SweepSpace space) {
    ImmutableList<ParameterDistribution<?>> distributions = space.distributions().distributions();
    checkConfiguration(!distributions.isEmpty(), "A sweep needs at least one distribution");

    ConstraintSet constraints = space.constraints();
    ImmutableList<ImmutableList<Constraint>> checksByDepth =
        checksByDepth(distributions, constraints);

    ImmutableList.Builder<Combination> out = ImmutableList.builder();
    bind(0, distributions, checksByDepth, constraints, new LinkedHashMap<>(), out);
    return out.build();
  }

  private void bind(
      int depth,
      ImmutableList<ParameterDistribution<?>> distributions,
      ImmutableList<ImmutableList<Constraint>> checksByDepth,
      ConstraintSet constraints,
      LinkedHashMap<String, Comparable<?>> assignment,
      ImmutableList.Builder<Combination> out) {
    if (depth == distributions.size()) {
      out.add(Combination.of(assignment));
      return;
    }

    ParameterDistribution<?> distribution = distributions.get(depth);
    ImmutableList<Constraint> checks = checksByDepth.get(depth);
    for (Comparable<?> value : distribution.values()) {
      assignment.put(distribution.label(), value);
      if (satisfiesAll(checks, constraints, assignment)) {
        bind(depth + 1, distributions, checksByDepth, constraints, assignment, out);
      }
    }
    assignment.remove(distribution.label());
  }

  private static boolean satisfiesAll(
      ImmutableList<Constraint> checks,
      ConstraintSet constraints,
      Map<String, Comparable<?>> assignment) {
    if (checks.isEmpty()) {
      return true;
    }
    for (Constraint constraint : checks) {
      if (!constraints.evaluate(constraint, assignment)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Groups constraints by the depth at which their last distribution gets bound. Each constraint
   * is then checked exactly once per partial assignment, at the earliest possible point.
   */
  private static ImmutableList<ImmutableList<Constraint>> checksByDepth(
      ImmutableList<ParameterDistribution<?>> distributions, ConstraintSet constraints) {
    List<String> order = new ArrayList<>();
    distributions.forEach(distribution -> order.add(distribution.label()));

    List<ImmutableList.Builder<Constraint>> builders = new ArrayList<>();
    for (int i = 0; i < distributions.size(); i++) {
      builders.add(ImmutableList.builder());
    }
    for (Constraint constraint : constraints.constraints()) {
      int depth =
          Math.max(order.indexOf(constraint.leftLabel()), order.indexOf(constraint.rightLabel()));
      builders.get(depth).add(constraint);
    }
    return builders.stream()
        .map(ImmutableList.Builder::build)
        .collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<Combination> sample(
      ImmutableList<Combination> valid, SamplingPlan plan) {
    int k = plan.sampleCount();
    int m = valid.size();
    if (plan.isExhaustive() || k >= m) {
      return valid;
    }

    // Partial Fisher-Yates over indices, then restore generation order.
    Random random = new Random(plan.seed());
    int[] indices = new int[m];
    for (int i = 0; i < m; i++) {
      indices[i] = i;
    }
    for (int i = 0; i < k; i++) {
      int j = i + random.nextInt(m - i);
      int swap = indices[i];
      indices[i] = indices[j];
      indices[j] = swap;
    }
    int[] chosen = Arrays.copyOf(indices, k);
    Arrays.sort(chosen);

    return Arrays.stream(chosen)
        .mapToObj(valid::get)
        .collect(ImmutableList.toImmutableList());
  }

  private static long fullProductSize(SweepSpace space) {
    long size = 1;
    for (ParameterDistribution<?> distribution : space.distributions().distributions()) {
      size = LongMath.saturatedMultiply(size, distribution.size());
    }
    return size;
  }
}
