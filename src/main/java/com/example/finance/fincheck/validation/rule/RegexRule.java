package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Requires the pattern to match at the start of the string. Anchor with {@code $} to demand a
 * full match.
 */
public class RegexRule implements FieldRule {

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.REGEX;
  }

  @Override
  public void checkParameters(RuleDescriptor descriptor) {
    String regex = RuleParameters.text(descriptor, RuleDescriptor.PATTERN);
    if (regex != null && !regex.isEmpty()) {
      compile(regex);
    }
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    String regex = RuleParameters.text(descriptor, RuleDescriptor.PATTERN);
    if (regex == null || regex.isEmpty() || !(value instanceof String text)) {
      return ValidationOutcome.passed();
    }
    if (!compile(regex).matcher(text).lookingAt()) {
      return ValidationOutcome.failed(descriptor.errorOr("Value doesn't match required pattern"));
    }
    return ValidationOutcome.passed();
  }

  private static Pattern compile(String regex) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException ex) {
      throw new RuleConfigurationException("REGEX pattern does not compile: " + regex, ex);
    }
  }
}
