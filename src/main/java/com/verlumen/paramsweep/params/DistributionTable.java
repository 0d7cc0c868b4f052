package com.verlumen.paramsweep.params;

import static com.verlumen.paramsweep.params.SweepConfigurationException.checkConfiguration;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The distributions declared for one sweep configuration, in declaration order.
 *
 * <p>Each table is local to the configuration that owns it; labels only need to be unique within
 * a single table.
 */
public final class DistributionTable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<String, ParameterDistribution<?>> distributions = new LinkedHashMap<>();

  /**
   * Declares a new distribution.
   *
   * @throws SweepConfigurationException if the label is already used in this table or the
   *     declaration itself is invalid
   */
  public <T extends Comparable<? super T>> ParameterDistribution<T> declare(
      String label, BindingTarget bindingTarget, Iterable<T> values) {
    ParameterDistribution<T> distribution =
        ParameterDistribution.create(label, bindingTarget, values);
    checkConfiguration(!distributions.containsKey(label),
        "Distribution %s is already declared", label);
    distributions.put(label, distribution);
    logger.atFine().log(
        "Declared distribution %s -> %s with %d values", label, bindingTarget.name(),
        distribution.size());
    return distribution;
  }

  public boolean contains(String label) {
    return distributions.containsKey(label);
  }

  /**
   * Returns the declared distribution for {@code label}.
   *
   * @throws SweepConfigurationException if no distribution has that label
   */
  public ParameterDistribution<?> get(String label) {
    ParameterDistribution<?> distribution = distributions.get(label);
    checkConfiguration(distribution != null, "Unknown distribution: %s", label);
    return distribution;
  }

  /** Returns the ordered candidate values of the distribution labelled {@code label}. */
  public ImmutableList<? extends Comparable<?>> valuesOf(String label) {
    return get(label).values();
  }

  /**
   * Returns the label of the single distribution bound to {@code target}.
   *
   * @throws SweepConfigurationException if no distribution, or more than one, binds the target
   */
  public String labelFor(BindingTarget target) {
    ImmutableList<String> labels =
        distributions.values().stream()
            .filter(distribution -> distribution.bindingTarget().equals(target))
            .map(ParameterDistribution::label)
            .collect(ImmutableList.toImmutableList());
    checkConfiguration(!labels.isEmpty(), "No distribution binds %s", target.name());
    checkConfiguration(labels.size() == 1,
        "Binding target %s is bound by several distributions: %s", target.name(), labels);
    return labels.get(0);
  }

  /** All distributions, in declaration order. */
  public ImmutableList<ParameterDistribution<?>> distributions() {
    return ImmutableList.copyOf(distributions.values());
  }

  public int size() {
    return distributions.size();
  }

  public boolean isEmpty() {
    return distributions.isEmpty();
  }
}
