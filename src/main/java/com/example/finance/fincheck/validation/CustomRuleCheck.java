package com.example.finance.fincheck.validation;

/** Caller-supplied check backing a {@link ValidationRuleKind#CUSTOM} rule. */
@FunctionalInterface
public interface CustomRuleCheck {

  /**
   * Checks the raw value. Must not return {@code null}.
   *
   * @param value the raw field value, never absent (null or empty string)
   * @param descriptor the descriptor being applied, for access to parameters and messages
   */
  ValidationOutcome check(Object value, RuleDescriptor descriptor);
}
