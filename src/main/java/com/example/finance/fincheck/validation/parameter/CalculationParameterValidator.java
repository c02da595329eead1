package com.example.finance.fincheck.validation.parameter;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Sanity checks on the inputs of loan and NPV calculations. */
@Service
@RequiredArgsConstructor
public class CalculationParameterValidator {

  static final double HIGH_RATE = 0.5;
  static final int LONG_TERM_YEARS = 50;

  private final FieldValidator fieldValidator;

  /**
   * @param principal loan amount, must be positive
   * @param annualRate decimal rate, e.g. {@code 0.05} for 5%
   * @param years loan term
   */
  public ValidationOutcome validateLoan(Double principal, double annualRate, int years) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    errors.addAll(fieldValidator
        .validateField(principal, List.of(RuleDescriptor.required(), RuleDescriptor.positive()))
        .errors());

    if (annualRate > 1) {
      warnings.add("Interest rate appears to be in percentage form - should be decimal");
    } else if (annualRate <= 0) {
      errors.add("Interest rate must be positive");
    }
    if (annualRate > HIGH_RATE) {
      warnings.add("Very high interest rate - please verify");
    }

    if (years <= 0) {
      errors.add("Loan term must be positive");
    } else if (years > LONG_TERM_YEARS) {
      warnings.add("Very long loan term - please verify");
    }
    return ValidationOutcome.of(errors, warnings);
  }

  public ValidationOutcome validateNpv(Double rate, List<Double> cashFlows) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    if (rate == null || rate.isNaN()) {
      errors.add("Discount rate must be numeric");
    } else if (rate < -1 || rate > 1) {
      warnings.add("Unusual discount rate - should typically be between 0% and 50%");
    }

    List<Double> flows = cashFlows == null ? List.of() : cashFlows;
    if (flows.isEmpty()) {
      errors.add("Cash flows cannot be empty");
    } else {
      if (flows.size() < 2) {
        warnings.add("NPV typically requires multiple periods");
      }
      if (flows.stream().allMatch(flow -> flow == null || flow == 0)) {
        errors.add("All cash flows cannot be zero");
      }
    }
    return ValidationOutcome.of(errors, warnings);
  }
}
