package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.regex.Pattern;

/** Rejects null, empty and whitespace-only values. Any Unicode space counts as whitespace. */
public class RequiredRule implements FieldRule {

  private static final Pattern BLANK = Pattern.compile("\\s*", Pattern.UNICODE_CHARACTER_CLASS);

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.REQUIRED;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value == null || (value instanceof String text && BLANK.matcher(text).matches())) {
      return ValidationOutcome.failed(descriptor.errorOr("Field is required"));
    }
    return ValidationOutcome.passed();
  }
}
