package com.example.finance.fincheck.validation.record;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FinancialStatementValidatorTest {

  private final FinancialStatementValidator validator =
      new FinancialStatementValidator(FieldValidator.withDefaults());

  @Test
  void balancedStatementPasses() {
    Map<String, ValidationOutcome> results = validator.validate(Map.of(
        "revenue", 100000,
        "expenses", 80000,
        "assets", 150000,
        "liabilities", 50000,
        "equity", 100000));

    assertThat(results.values()).allMatch(ValidationOutcome::valid);
    assertThat(results).containsKey(FinancialStatementValidator.BALANCE_CHECK);
  }

  @Test
  void differenceWithinToleranceStillBalances() {
    Map<String, ValidationOutcome> results = validator.validate(Map.of(
        "revenue", 1,
        "expenses", 1,
        "assets", "1,000.005",
        "liabilities", 400,
        "equity", "600"));

    assertThat(results.get(FinancialStatementValidator.BALANCE_CHECK).valid()).isTrue();
  }

  @Test
  void unbalancedStatementFails() {
    Map<String, ValidationOutcome> results = validator.validate(Map.of(
        "revenue", 100000,
        "expenses", 80000,
        "assets", 150000,
        "liabilities", 50000,
        "equity", 90000));

    assertThat(results.get(FinancialStatementValidator.BALANCE_CHECK).errors())
        .containsExactly("Balance sheet doesn't balance: Assets ≠ Liabilities + Equity");
  }

  @Test
  void balanceCheckNeedsAllThreeFigures() {
    Map<String, ValidationOutcome> results = validator.validate(Map.of(
        "revenue", "-10",
        "expenses", 5,
        "assets", 10));

    assertThat(results.get("revenue").errors()).containsExactly("Value must be positive");
    assertThat(results).doesNotContainKey(FinancialStatementValidator.BALANCE_CHECK);
  }
}
