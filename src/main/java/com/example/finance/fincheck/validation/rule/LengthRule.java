package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;

/** String length in code points; non-string values are not checked. */
public class LengthRule implements FieldRule {

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.LENGTH;
  }

  @Override
  public void checkParameters(RuleDescriptor descriptor) {
    RuleParameters.requireNumbers(descriptor, RuleDescriptor.MIN, RuleDescriptor.MAX);
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    Double min = RuleParameters.number(descriptor, RuleDescriptor.MIN);
    Double max = RuleParameters.number(descriptor, RuleDescriptor.MAX);
    double minLength = min == null ? 0 : min;
    double maxLength = max == null ? Double.POSITIVE_INFINITY : max;

    if (!(value instanceof String text)) {
      return ValidationOutcome.passed();
    }
    int length = text.codePointCount(0, text.length());
    if (length < minLength) {
      return ValidationOutcome.failed(
          descriptor.errorOr("Minimum length is " + RuleParameters.format(minLength)));
    }
    if (length > maxLength) {
      return ValidationOutcome.failed(
          descriptor.errorOr("Maximum length is " + RuleParameters.format(maxLength)));
    }
    return ValidationOutcome.passed();
  }
}
