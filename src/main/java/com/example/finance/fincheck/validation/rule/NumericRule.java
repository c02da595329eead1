package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses numbers, accepting formatted strings such as {@code "$1,234.56"} or {@code "1 234"}
 * with a no-break space. The cleaned value is always a {@link Double}.
 */
public class NumericRule implements FieldRule {

  private static final Pattern PLAIN_NUMBER =
      Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

  private final Pattern noise;

  public NumericRule(List<String> currencySymbols) {
    String symbols = currencySymbols.stream()
        .filter(symbol -> symbol != null && !symbol.isEmpty())
        .map(Pattern::quote)
        .collect(Collectors.joining("|"));
    this.noise = Pattern.compile(
        symbols.isEmpty() ? "[,\\s]" : "(?:" + symbols + "|[,\\s])", Pattern.UNICODE_CHARACTER_CLASS);
  }

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.NUMERIC;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value instanceof Number number && !(value instanceof Boolean)) {
      return ValidationOutcome.cleaned(number.doubleValue());
    }
    if (!(value instanceof String text)) {
      return ValidationOutcome.failed(descriptor.errorOr("Value must be numeric"));
    }
    String stripped = noise.matcher(text).replaceAll("");
    if (!PLAIN_NUMBER.matcher(stripped).matches()) {
      return ValidationOutcome.failed(descriptor.errorOr("Invalid numeric value"));
    }
    return ValidationOutcome.cleaned(Double.parseDouble(stripped));
  }
}
