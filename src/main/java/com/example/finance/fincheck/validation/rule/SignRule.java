package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;

/** POSITIVE and NEGATIVE: strictly greater or strictly less than zero. */
public class SignRule implements FieldRule {

  private final ValidationRuleKind kind;
  private final NumericRule numeric;

  private SignRule(ValidationRuleKind kind, NumericRule numeric) {
    this.kind = kind;
    this.numeric = numeric;
  }

  public static SignRule positive(NumericRule numeric) {
    return new SignRule(ValidationRuleKind.POSITIVE, numeric);
  }

  public static SignRule negative(NumericRule numeric) {
    return new SignRule(ValidationRuleKind.NEGATIVE, numeric);
  }

  @Override
  public ValidationRuleKind kind() {
    return kind;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    ValidationOutcome parsed = numeric.apply(value, descriptor);
    if (!parsed.valid()) {
      return parsed;
    }
    double number = (Double) parsed.cleanedValue();
    if (kind == ValidationRuleKind.POSITIVE && !(number > 0)) {
      return ValidationOutcome.failed(descriptor.errorOr("Value must be positive"));
    }
    if (kind == ValidationRuleKind.NEGATIVE && !(number < 0)) {
      return ValidationOutcome.failed(descriptor.errorOr("Value must be negative"));
    }
    return parsed;
  }
}
