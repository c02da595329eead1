package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/** Typed access to descriptor parameters. */
final class RuleParameters {

  private RuleParameters() {}

  /** Fails with every malformed numeric parameter among {@code names} at once. */
  static void requireNumbers(RuleDescriptor descriptor, String... names) {
    List<String> reasons = new ArrayList<>();
    for (String name : names) {
      String problem = numberProblem(descriptor, name);
      if (problem != null) {
        reasons.add(problem);
      }
    }
    if (!reasons.isEmpty()) {
      throw new RuleConfigurationException(reasons);
    }
  }

  /** Returns the numeric parameter, or {@code null} when it is not set. */
  static Double number(RuleDescriptor descriptor, String name) {
    String problem = numberProblem(descriptor, name);
    if (problem != null) {
      throw new RuleConfigurationException(problem);
    }
    Object raw = descriptor.parameter(name);
    return raw == null ? null : ((Number) raw).doubleValue();
  }

  /** Returns the string parameter, or {@code null} when it is not set. */
  static String text(RuleDescriptor descriptor, String name) {
    Object raw = descriptor.parameter(name);
    if (raw == null) {
      return null;
    }
    if (raw instanceof String text) {
      return text;
    }
    throw new RuleConfigurationException(
        "%s parameter '%s' must be a string but was %s"
            .formatted(descriptor.getKind(), name, raw.getClass().getSimpleName()));
  }

  /** Renders a bound for messages: {@code 100} rather than {@code 100.0}. */
  static String format(double bound) {
    if (Double.isInfinite(bound)) {
      return bound > 0 ? "inf" : "-inf";
    }
    return BigDecimal.valueOf(bound).stripTrailingZeros().toPlainString();
  }

  private static String numberProblem(RuleDescriptor descriptor, String name) {
    Object raw = descriptor.parameter(name);
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number number && !(raw instanceof Boolean)) {
      return Double.isNaN(number.doubleValue())
          ? "%s parameter '%s' must not be NaN".formatted(descriptor.getKind(), name)
          : null;
    }
    return "%s parameter '%s' must be a number but was %s"
        .formatted(descriptor.getKind(), name, raw.getClass().getSimpleName());
  }
}
