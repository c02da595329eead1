package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;

/** Numeric value within the optional, inclusive {@code min}/{@code max} bounds. */
public class RangeRule implements FieldRule {

  private final NumericRule numeric;

  public RangeRule(NumericRule numeric) {
    this.numeric = numeric;
  }

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.RANGE;
  }

  @Override
  public void checkParameters(RuleDescriptor descriptor) {
    RuleParameters.requireNumbers(descriptor, RuleDescriptor.MIN, RuleDescriptor.MAX);
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    Double min = RuleParameters.number(descriptor, RuleDescriptor.MIN);
    Double max = RuleParameters.number(descriptor, RuleDescriptor.MAX);

    ValidationOutcome parsed = numeric.apply(value, descriptor);
    if (!parsed.valid()) {
      return parsed;
    }
    double number = (Double) parsed.cleanedValue();
    if (min != null && number < min) {
      return ValidationOutcome.failed(
          descriptor.errorOr("Value must be at least " + RuleParameters.format(min)));
    }
    if (max != null && number > max) {
      return ValidationOutcome.failed(
          descriptor.errorOr("Value must not exceed " + RuleParameters.format(max)));
    }
    return parsed;
  }
}
