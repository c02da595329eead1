package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

/**
 * Parses dates by trying each configured format in order; the first one that fits wins, so
 * {@code 03/04/2024} is read month-first while {@code 15/03/2024} falls through to day-first.
 */
public class DateRule implements FieldRule {

  private final List<DateTimeFormatter> formats;

  public DateRule(List<String> patterns) {
    this.formats = patterns.stream().map(DateRule::formatter).toList();
  }

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.DATE;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value instanceof LocalDate date) {
      return ValidationOutcome.cleaned(date);
    }
    if (value instanceof LocalDateTime dateTime) {
      return ValidationOutcome.cleaned(dateTime.toLocalDate());
    }
    if (value instanceof String text) {
      for (DateTimeFormatter format : formats) {
        try {
          return ValidationOutcome.cleaned(LocalDate.from(format.parse(text)));
        } catch (DateTimeException ex) {
          // try the next format
        }
      }
    }
    return ValidationOutcome.failed(descriptor.errorOr("Invalid date format"));
  }

  private static DateTimeFormatter formatter(String pattern) {
    try {
      return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    } catch (IllegalArgumentException ex) {
      throw new RuleConfigurationException("Invalid date format pattern: " + pattern, ex);
    }
  }
}
