package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.CustomRuleCheck;
import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;

/** Runs the descriptor's {@link CustomRuleCheck}; without one the value passes untouched. */
public class CustomRule implements FieldRule {

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.CUSTOM;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    CustomRuleCheck check = descriptor.getCustomCheck();
    if (check == null) {
      return ValidationOutcome.passed();
    }
    ValidationOutcome outcome = check.check(value, descriptor);
    if (outcome == null) {
      throw new RuleConfigurationException("CUSTOM check returned no outcome");
    }
    return outcome;
  }
}
