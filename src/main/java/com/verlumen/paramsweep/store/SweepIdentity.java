package com.verlumen.paramsweep.store;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.stream.Collectors.joining;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.hash.Hashing;
import com.verlumen.paramsweep.constraints.Constraint;
import com.verlumen.paramsweep.generation.SamplingPlan;
import com.verlumen.paramsweep.generation.SweepSpace;
import com.verlumen.paramsweep.params.ParameterDistribution;
import com.verlumen.paramsweep.params.Values;

/**
 * Deterministic key of a sweep.
 *
 * <p>The key is a SHA-256 digest over the strategy name, every distribution (label, binding
 * target, value type and values in order), every constraint and the sampling plan. Changing any
 * of them yields a different identity, so stored results are never reused for a sweep that would
 * produce a different result set. Worker-pool size and timeouts are not part of the identity.
 */
@AutoValue
public abstract class SweepIdentity {
  private static final CharMatcher FILE_NAME_SAFE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("-_"));

  public abstract String strategyName();

  /** Hex-encoded digest. */
  public abstract String digest();

  public static SweepIdentity of(String strategyName, String digest) {
    checkArgument(!isNullOrEmpty(strategyName), "Strategy name cannot be empty");
    checkArgument(!isNullOrEmpty(digest), "Digest cannot be empty");
    return new AutoValue_SweepIdentity(strategyName, digest);
  }

  public static SweepIdentity derive(String strategyName, SweepSpace space, SamplingPlan plan) {
    checkArgument(!isNullOrEmpty(strategyName), "Strategy name cannot be empty");
    String digest =
        Hashing.sha256().hashString(canonicalForm(strategyName, space, plan), UTF_8).toString();
    return of(strategyName, digest);
  }

  /** Name of the document holding this sweep's results, readable and unique per identity. */
  public String fileName() {
    String prefix = FILE_NAME_SAFE.negate().replaceFrom(strategyName(), '_');
    return prefix + "-" + digest() + ".json";
  }

  /** Every free-text field is length-prefixed so that separators inside it cannot collide. */
  static String canonicalForm(String strategyName, SweepSpace space, SamplingPlan plan) {
    StringBuilder canonical = new StringBuilder();
    canonical.append("strategy=").append(field(strategyName)).append('\n');
    for (ParameterDistribution<?> distribution : space.distributions().distributions()) {
      canonical
          .append("distribution=")
          .append(field(distribution.label()))
          .append('|')
          .append(field(Values.typeOf(distribution.bindingTarget()).getName()
              + "." + distribution.bindingTarget().name()))
          .append('|')
          .append(field(distribution.valueType().getName()))
          .append('|')
          .append(
              distribution.values().stream()
                  .map(Object::toString)
                  .map(SweepIdentity::field)
                  .collect(joining(",")))
          .append('\n');
    }
    for (Constraint constraint : space.constraints().constraints()) {
      canonical
          .append("constraint=")
          .append(field(constraint.label()))
          .append('|')
          .append(field(constraint.leftLabel()))
          .append('|')
          .append(constraint.operator().name())
          .append('|')
          .append(field(constraint.rightLabel()))
          .append('\n');
    }
    canonical
        .append("sample=")
        .append(plan.sampleCount())
        .append("|seed=")
        .append(plan.seed());
    return canonical.toString();
  }

  private static String field(String text) {
    return text.length() + ":" + text;
  }

  @Override
  public final String toString() {
    return strategyName() + "@" + digest().substring(0, Math.min(12, digest().length()));
  }
}
