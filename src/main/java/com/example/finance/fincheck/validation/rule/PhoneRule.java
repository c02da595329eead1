package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Accepts numbers matching any configured pattern; the cleaned form keeps digits and '+'. */
public class PhoneRule implements FieldRule {

  private static final Pattern NOT_DIAL_CHAR = Pattern.compile("[^\\d+]");

  private final List<Pattern> patterns;

  public PhoneRule(List<String> patterns) {
    this.patterns = patterns.stream().map(PhoneRule::compile).toList();
  }

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.PHONE;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value instanceof String text) {
      for (Pattern pattern : patterns) {
        if (pattern.matcher(text).matches()) {
          return ValidationOutcome.cleaned(NOT_DIAL_CHAR.matcher(text).replaceAll(""));
        }
      }
    }
    return ValidationOutcome.failed(descriptor.errorOr("Invalid phone format"));
  }

  private static Pattern compile(String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException ex) {
      throw new RuleConfigurationException("Invalid phone pattern: " + regex, ex);
    }
  }
}
