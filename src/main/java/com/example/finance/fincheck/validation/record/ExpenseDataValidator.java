package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.model.ExpenseCategory;
import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Expense entries: amount, vendor, category and free-text fields. */
@Component
@RequiredArgsConstructor
public class ExpenseDataValidator implements RecordValidator {

  public static final String AMOUNT_CHECK = "amount_check";

  static final double LARGE_EXPENSE_THRESHOLD = 100_000;

  private static final Map<String, List<RuleDescriptor>> FIELD_RULES;

  static {
    Map<String, List<RuleDescriptor>> rules = new LinkedHashMap<>();
    rules.put("amount",
        List.of(RuleDescriptor.required(), RuleDescriptor.currency(), RuleDescriptor.positive()));
    rules.put("date", List.of(RuleDescriptor.required(), RuleDescriptor.date()));
    rules.put("vendor_id", List.of(RuleDescriptor.required(), RuleDescriptor.length(1, 50)));
    rules.put("category", List.of(RuleDescriptor.required()));
    rules.put("invoice_number", List.of(RuleDescriptor.length(null, 50)));
    rules.put("description", List.of(RuleDescriptor.length(null, 500)));
    FIELD_RULES = Collections.unmodifiableMap(rules);
  }

  private final FieldValidator fieldValidator;

  @Override
  public String name() {
    return "expense";
  }

  @Override
  public Map<String, List<RuleDescriptor>> fieldRules() {
    return FIELD_RULES;
  }

  @Override
  public Map<String, ValidationOutcome> validate(Map<String, ?> record) {
    Map<String, ?> source = record == null ? Map.of() : record;
    Map<String, ValidationOutcome> results = fieldValidator.validateRecord(source, FIELD_RULES);

    CrossFieldChecks.requireOneOf(source, results, "category", ExpenseCategory.labels(),
        "Invalid category. Must be one of: " + String.join(", ", ExpenseCategory.labels()));

    ValidationOutcome amount = results.get("amount");
    if (amount != null && amount.valid()
        && CrossFieldChecks.amountOf(results, "amount") > LARGE_EXPENSE_THRESHOLD) {
      results.put(AMOUNT_CHECK,
          ValidationOutcome.warned("Large expense amount - please verify accuracy", null));
    }
    return results;
  }
}
