package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Extracts the first amount from strings such as {@code "USD 1,500.00 / month"}. */
public class CurrencyRule implements FieldRule {

  private static final Pattern AMOUNT = Pattern.compile("[\\d,]+\\.?\\d*");

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.CURRENCY;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value instanceof Number number && !(value instanceof Boolean)) {
      return ValidationOutcome.cleaned(number.doubleValue());
    }
    if (value instanceof String text) {
      Matcher matcher = AMOUNT.matcher(text);
      if (matcher.find()) {
        String amount = matcher.group().replace(",", "");
        if (!amount.isEmpty() && !amount.equals(".")) {
          return ValidationOutcome.cleaned(Double.parseDouble(amount));
        }
      }
    }
    return ValidationOutcome.failed(descriptor.errorOr("Invalid currency format"));
  }
}
