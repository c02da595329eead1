package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.Locale;
import java.util.regex.Pattern;

public class EmailRule implements FieldRule {

  private static final Pattern EMAIL =
      Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.EMAIL;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value instanceof String text && EMAIL.matcher(text).matches()) {
      return ValidationOutcome.cleaned(text.toLowerCase(Locale.ROOT));
    }
    return ValidationOutcome.failed(descriptor.errorOr("Invalid email format"));
  }
}
