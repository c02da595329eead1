package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;

/** Handler for one {@link ValidationRuleKind}. */
public interface FieldRule {

  ValidationRuleKind kind();

  /**
   * Rejects a malformed descriptor with a {@link
   * com.example.finance.fincheck.validation.RuleConfigurationException}. Runs before every {@link
   * #apply}, including for absent values.
   */
  default void checkParameters(RuleDescriptor descriptor) {}

  /**
   * Applies the rule to a raw value. Except for REQUIRED, callers only pass present values (not
   * null and not the empty string).
   */
  ValidationOutcome apply(Object value, RuleDescriptor descriptor);
}
