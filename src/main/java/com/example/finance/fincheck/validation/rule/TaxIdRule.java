package com.example.finance.fincheck.validation.rule;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import java.util.regex.Pattern;

/** US tax identifiers: EIN ({@code NN-NNNNNNN}) or SSN ({@code NNN-NN-NNNN}). */
public class TaxIdRule implements FieldRule {

  private static final Pattern EIN = Pattern.compile("\\d{2}-\\d{7}");
  private static final Pattern SSN = Pattern.compile("\\d{3}-\\d{2}-\\d{4}");
  private static final Pattern NOISE = Pattern.compile("[^\\d-]");

  @Override
  public ValidationRuleKind kind() {
    return ValidationRuleKind.TAX_ID;
  }

  @Override
  public ValidationOutcome apply(Object value, RuleDescriptor descriptor) {
    if (value instanceof String text) {
      String cleaned = NOISE.matcher(text).replaceAll("");
      if (EIN.matcher(cleaned).matches() || SSN.matcher(cleaned).matches()) {
        return ValidationOutcome.cleaned(cleaned);
      }
    }
    return ValidationOutcome.failed(descriptor.errorOr("Invalid Tax ID format"));
  }
}
