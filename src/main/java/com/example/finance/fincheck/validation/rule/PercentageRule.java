package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;

/**
 * Normalizes percentages to fractions: {@code "50%"} becomes {@code 0.5}, while a bare {@code 50}
 * is kept as is. Values outside [0, 1] only produce a warning.
 */
public class PercentageRule implements FieldRule {

  private final NumericRule numeric;

  public PercentageRule(NumericRule numeric) {
    this.numeric = numeric;
  }

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.PERCENTAGE;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    boolean percentSign = value instanceof String text && text.contains("%");
    Object candidate = percentSign ? ((String) value).replace("%", "") : value;

    ValidationOutcome parsed = numeric.apply(candidate, descriptor);
    if (!parsed.valid()) {
      return parsed;
    }
    double fraction = (Double) parsed.cleanedValue();
    if (percentSign) {
      fraction = fraction / 100;
    }
    if (!(fraction >= 0 && fraction <= 1)) {
      return ValidationOutcome.warned(
          descriptor.warningOr("Percentage should be between 0% and 100%"), fraction);
    }
    return ValidationOutcome.cleaned(fraction);
  }
}
