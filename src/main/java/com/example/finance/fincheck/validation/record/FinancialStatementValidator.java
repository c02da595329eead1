package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Income and balance sheet figures, plus the accounting equation check. */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinancialStatementValidator implements RecordValidator {

  public static final String BALANCE_CHECK = "balance_check";

  private static final Map<String, List<RuleDescriptor>> FIELD_RULES;

  static {
    Map<String, List<RuleDescriptor>> rules = new LinkedHashMap<>();
    rules.put("revenue", List.of(RuleDescriptor.required(), RuleDescriptor.positive()));
    rules.put("expenses", List.of(RuleDescriptor.required(), RuleDescriptor.positive()));
    rules.put("assets", List.of(RuleDescriptor.positive()));
    rules.put("liabilities", List.of(RuleDescriptor.positive()));
    rules.put("equity", List.of(RuleDescriptor.numeric()));
    FIELD_RULES = Collections.unmodifiableMap(rules);
  }

  private final FieldValidator fieldValidator;

  @Override
  public String name() {
    return "financial-statement";
  }

  @Override
  public Map<String, List<RuleDescriptor>> fieldRules() {
    return FIELD_RULES;
  }

  @Override
  public Map<String, ValidationOutcome> validate(Map<String, ?> record) {
    Map<String, ValidationOutcome> results = fieldValidator.validateRecord(record, FIELD_RULES);

    if (results.containsKey("assets") && results.containsKey("liabilities") && results.containsKey("equity")) {
      double assets = CrossFieldChecks.amountOf(results, "assets");
      double liabilities = CrossFieldChecks.amountOf(results, "liabilities");
      double equity = CrossFieldChecks.amountOf(results, "equity");
      if (CrossFieldChecks.balances(assets, liabilities + equity)) {
        results.put(BALANCE_CHECK, ValidationOutcome.passed());
      } else {
        log.debug("Balance sheet off by {}", assets - (liabilities + equity));
        results.put(BALANCE_CHECK,
            ValidationOutcome.failed("Balance sheet doesn't balance: Assets ≠ Liabilities + Equity"));
      }
    }
    return results;
  }
}
