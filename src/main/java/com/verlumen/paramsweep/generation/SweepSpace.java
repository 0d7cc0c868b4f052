package com.verlumen.paramsweep.generation;

import com.verlumen.paramsweep.constraints.Constraint;
import com.verlumen.paramsweep.constraints.ConstraintSet;
import com.verlumen.paramsweep.constraints.RelationalOperator;
import com.verlumen.paramsweep.params.BindingTarget;
import com.verlumen.paramsweep.params.DistributionTable;
import com.verlumen.paramsweep.params.ParameterDistribution;

/**
 * The declarative description of a parameter space: distributions plus the constraints between
 * them. Declarations are validated eagerly, so an invalid space never reaches the generator.
 */
public final class SweepSpace {
  private final DistributionTable distributions = new DistributionTable();
  private final ConstraintSet constraints = new ConstraintSet(distributions);

  public static SweepSpace create() {
    return new SweepSpace();
  }

  public <T extends Comparable<? super T>> ParameterDistribution<T> declare(
      String label, BindingTarget bindingTarget, Iterable<T> values) {
    return distributions.declare(label, bindingTarget, values);
  }

  public Constraint declareConstraint(
      String label, String leftLabel, String rightLabel, RelationalOperator operator) {
    return constraints.declareConstraint(label, leftLabel, rightLabel, operator);
  }

  public Constraint declareConstraint(
      String label, String leftLabel, String rightLabel, String operatorSymbol) {
    return constraints.declareConstraint(label, leftLabel, rightLabel, operatorSymbol);
  }

  public DistributionTable distributions() {
    return distributions;
  }

  public ConstraintSet constraints() {
    return constraints;
  }

  private SweepSpace() {}
}
