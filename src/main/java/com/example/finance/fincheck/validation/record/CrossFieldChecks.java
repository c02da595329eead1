package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.List;
import java.util.Map;

/** Constants and helpers shared by the record validators. */
public final class CrossFieldChecks {

  /** Absolute tolerance for money equalities such as assets = liabilities + equity. */
  public static final double BALANCE_TOLERANCE = 0.01;

  private CrossFieldChecks() {}

  /** Cleaned numeric value of a field outcome, 0 when the field is missing or was not cleaned. */
  static double amountOf(Map<String, ValidationOutcome> results, String field) {
    ValidationOutcome outcome = results.get(field);
    if (outcome != null && outcome.cleanedValue() instanceof Number number) {
      return number.doubleValue();
    }
    return 0;
  }

  static boolean balances(double left, double right) {
    return Math.abs(left - right) <= BALANCE_TOLERANCE;
  }

  /**
   * Appends {@code message} to the field's outcome when the raw value is present but not one of
   * {@code allowed}. Missing values are left to the REQUIRED rule.
   */
  static void requireOneOf(
      Map<String, ?> record,
      Map<String, ValidationOutcome> results,
      String field,
      List<String> allowed,
      String message) {
    Object raw = record.get(field);
    if (raw == null || (raw instanceof String s && s.isEmpty())) {
      return;
    }
    if (!(raw instanceof String text) || !allowed.contains(text)) {
      ValidationOutcome current = results.getOrDefault(field, ValidationOutcome.passed());
      results.put(field, current.withError(message));
    }
  }
}
