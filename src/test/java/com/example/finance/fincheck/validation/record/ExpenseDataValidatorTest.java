package com.example.finance.fincheck.validation.record;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpenseDataValidatorTest {

  private final ExpenseDataValidator validator = new ExpenseDataValidator(FieldValidator.withDefaults());

  private Map<String, Object> expense() {
    Map<String, Object> expense = new HashMap<>();
    expense.put("amount", "$250.00");
    expense.put("date", "2024-05-01");
    expense.put("vendor_id", "V-001");
    expense.put("category", "Office Supplies");
    return expense;
  }

  @Test
  void validExpensePasses() {
    Map<String, ValidationOutcome> results = validator.validate(expense());

    assertThat(results.values()).allMatch(ValidationOutcome::valid);
    assertThat(results.get("amount").cleanedValue()).isEqualTo(250.0);
    assertThat(results).doesNotContainKey(ExpenseDataValidator.AMOUNT_CHECK);
  }

  @Test
  void unknownCategoryIsRejected() {
    Map<String, Object> expense = expense();
    expense.put("category", "Snacks");

    ValidationOutcome category = validator.validate(expense).get("category");

    assertThat(category.valid()).isFalse();
    assertThat(category.errors()).singleElement().asString()
        .startsWith("Invalid category. Must be one of: Rent/Lease, Utilities");
  }

  @Test
  void largeAmountProducesWarning() {
    Map<String, Object> expense = expense();
    expense.put("amount", "$150,000");

    ValidationOutcome check = validator.validate(expense).get(ExpenseDataValidator.AMOUNT_CHECK);

    assertThat(check.valid()).isTrue();
    assertThat(check.warnings()).containsExactly("Large expense amount - please verify accuracy");
  }

  @Test
  void vendorIdLengthIsEnforced() {
    Map<String, Object> expense = expense();
    expense.put("vendor_id", "V".repeat(51));

    assertThat(validator.validate(expense).get("vendor_id").errors())
        .containsExactly("Maximum length is 50");
  }
}
