package com.example.finance.fincheck.validation;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a rule descriptor is malformed (bad parameters, unusable pattern, broken custom
 * check). Invalid field values never raise this; they produce a failed {@link ValidationOutcome}.
 */
public class RuleConfigurationException extends RuntimeException {

  private final List<String> reasons;

  public RuleConfigurationException(String message) {
    super(Objects.requireNonNull(message, "message"));
    this.reasons = List.of(message);
  }

  public RuleConfigurationException(String message, Throwable cause) {
    super(Objects.requireNonNull(message, "message"), cause);
    this.reasons = List.of(message);
  }

  public RuleConfigurationException(List<String> reasons) {
    super(formatMessage(reasons));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String formatMessage(List<String> reasons) {
    Objects.requireNonNull(reasons, "reasons");
    if (reasons.isEmpty()) {
      throw new IllegalArgumentException("reasons must not be empty");
    }
    if (reasons.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("reasons must not contain null entries");
    }
    return String.join("; ", reasons);
  }
}
