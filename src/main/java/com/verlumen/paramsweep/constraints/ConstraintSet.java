package com.verlumen.paramsweep.constraints;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Strings.isNullOrEmpty;
import static com.verlumen.paramsweep.params.SweepConfigurationException.checkConfiguration;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.paramsweep.params.Combination;
import com.verlumen.paramsweep.params.DistributionTable;
import com.verlumen.paramsweep.params.Values;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The constraints of one sweep configuration. A combination is valid only when every declared
 * constraint holds; with no constraints every combination is valid.
 */
public final class ConstraintSet {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final DistributionTable distributions;
  private final Map<String, Constraint> constraints = new LinkedHashMap<>();

  public ConstraintSet(DistributionTable distributions) {
    this.distributions = checkNotNull(distributions, "distributions");
  }

  /**
   * Declares a constraint given its operator symbol, such as {@code "<"} or {@code ">="}.
   *
   * @throws com.verlumen.paramsweep.params.SweepConfigurationException if the symbol is not
   *     supported or the declaration is otherwise invalid
   */
  public Constraint declareConstraint(
      String label, String leftLabel, String rightLabel, String operatorSymbol) {
    return declareConstraint(
        label, leftLabel, rightLabel, RelationalOperator.fromSymbol(operatorSymbol));
  }

  /**
   * Declares a constraint.
   *
   * @throws com.verlumen.paramsweep.params.SweepConfigurationException if either distribution is
   *     undeclared, the label is blank or already used, the operator is missing, or the two
   *     distributions hold values that cannot be ordered against each other
   */
  public Constraint declareConstraint(
      String label, String leftLabel, String rightLabel, RelationalOperator operator) {
    checkConfiguration(!isNullOrEmpty(label) && !label.isBlank(),
        "Constraint label cannot be empty");
    checkConfiguration(!constraints.containsKey(label), "Constraint %s is already declared", label);
    checkConfiguration(operator != null, "Constraint %s has no operator", label);
    checkConfiguration(distributions.contains(leftLabel),
        "Constraint %s refers to unknown distribution %s", label, leftLabel);
    checkConfiguration(distributions.contains(rightLabel),
        "Constraint %s refers to unknown distribution %s", label, rightLabel);

    Class<?> leftType = distributions.get(leftLabel).valueType();
    Class<?> rightType = distributions.get(rightLabel).valueType();
    checkConfiguration(Values.areComparable(leftType, rightType),
        "Constraint %s compares %s values with %s values",
        label, leftType.getSimpleName(), rightType.getSimpleName());

    Constraint constraint = Constraint.create(label, leftLabel, rightLabel, operator);
    constraints.put(label, constraint);
    logger.atFine().log("Declared constraint %s", constraint);
    return constraint;
  }

  /** Evaluates a single constraint against a combination. */
  public boolean evaluate(Constraint constraint, Combination combination) {
    return test(constraint, combination.get(constraint.leftLabel()),
        combination.get(constraint.rightLabel()));
  }

  /**
   * Evaluates a single constraint against an assignment that binds both of its distributions.
   */
  public boolean evaluate(Constraint constraint, Map<String, ? extends Comparable<?>> assignment) {
    return test(constraint, assignment.get(constraint.leftLabel()),
        assignment.get(constraint.rightLabel()));
  }

  /** True when every declared constraint holds for {@code combination}. */
  public boolean isSatisfied(Combination combination) {
    for (Constraint constraint : constraints.values()) {
      if (!evaluate(constraint, combination)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Evaluates the constraints whose distributions are all bound in {@code assignment}, ignoring
   * the rest. A partial assignment failing here can never be completed into a valid combination.
   */
  public boolean isSatisfiedByPartial(Map<String, ? extends Comparable<?>> assignment) {
    for (Constraint constraint : constraints.values()) {
      Comparable<?> left = assignment.get(constraint.leftLabel());
      Comparable<?> right = assignment.get(constraint.rightLabel());
      if (left != null && right != null && !test(constraint, left, right)) {
        return false;
      }
    }
    return true;
  }

  /** All constraints, in declaration order. */
  public ImmutableList<Constraint> constraints() {
    return ImmutableList.copyOf(constraints.values());
  }

  public boolean isEmpty() {
    return constraints.isEmpty();
  }

  private static boolean test(Constraint constraint, Comparable<?> left, Comparable<?> right) {
    return constraint.operator().test(Values.compare(left, right));
  }
}
