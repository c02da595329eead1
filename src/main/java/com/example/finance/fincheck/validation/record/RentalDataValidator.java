package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Rental listing and lease terms. */
@Component
@RequiredArgsConstructor
public class RentalDataValidator implements RecordValidator {

  public static final String DATE_RANGE = "date_range";

  static final long SHORT_LEASE_DAYS = 30;
  static final long LONG_LEASE_DAYS = 365 * 5;

  private static final Map<String, List<RuleDescriptor>> FIELD_RULES;

  static {
    Map<String, List<RuleDescriptor>> rules = new LinkedHashMap<>();
    rules.put("monthly_rent",
        List.of(RuleDescriptor.required(), RuleDescriptor.currency(), RuleDescriptor.positive()));
    rules.put("security_deposit", List.of(RuleDescriptor.currency(), RuleDescriptor.positive()));
    rules.put("lease_start_date", List.of(RuleDescriptor.required(), RuleDescriptor.date()));
    rules.put("lease_end_date", List.of(RuleDescriptor.required(), RuleDescriptor.date()));
    rules.put("square_feet", List.of(RuleDescriptor.positive(), RuleDescriptor.range(100, 50000)));
    rules.put("bedrooms", List.of(RuleDescriptor.range(0, 20)));
    rules.put("bathrooms", List.of(RuleDescriptor.range(0, 20)));
    FIELD_RULES = Collections.unmodifiableMap(rules);
  }

  private final FieldValidator fieldValidator;

  @Override
  public String name() {
    return "rental";
  }

  @Override
  public Map<String, List<RuleDescriptor>> fieldRules() {
    return FIELD_RULES;
  }

  @Override
  public Map<String, ValidationOutcome> validate(Map<String, ?> record) {
    Map<String, ValidationOutcome> results = fieldValidator.validateRecord(record, FIELD_RULES);

    ValidationOutcome start = results.get("lease_start_date");
    ValidationOutcome end = results.get("lease_end_date");
    if (start != null && end != null && start.valid() && end.valid()
        && start.cleanedValue() instanceof LocalDate startDate
        && end.cleanedValue() instanceof LocalDate endDate) {
      results.put(DATE_RANGE, checkLeaseTerm(startDate, endDate));
    }
    return results;
  }

  private static ValidationOutcome checkLeaseTerm(LocalDate start, LocalDate end) {
    if (!start.isBefore(end)) {
      return ValidationOutcome.failed("Lease start date must be before end date");
    }
    long days = ChronoUnit.DAYS.between(start, end);
    if (days < SHORT_LEASE_DAYS) {
      return ValidationOutcome.warned("Very short lease term - please verify", null);
    }
    if (days > LONG_LEASE_DAYS) {
      return ValidationOutcome.warned("Very long lease term - please verify", null);
    }
    return ValidationOutcome.passed();
  }
}
