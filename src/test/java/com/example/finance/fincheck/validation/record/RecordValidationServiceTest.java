package com.example.finance.fincheck.validation.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordValidationServiceTest {

  private final FieldValidator fieldValidator = FieldValidator.withDefaults();

  private final RecordValidationService service = new RecordValidationService(List.of(
      new FinancialStatementValidator(fieldValidator),
      new RentalDataValidator(fieldValidator),
      new ExpenseDataValidator(fieldValidator),
      new CashFlowDataValidator(fieldValidator)));

  @Test
  void dispatchesByName() {
    assertThat(service.names())
        .containsExactlyInAnyOrder("financial-statement", "rental", "expense", "cash-flow");

    Map<String, ValidationOutcome> results = service.validate("expense", Map.of("amount", "12"));

    assertThat(results).containsKeys("amount", "date", "vendor_id", "category");
    assertThat(RecordValidationService.allValid(results)).isFalse();
  }

  @Test
  void unknownRecordTypeIsRejected() {
    assertThatThrownBy(() -> service.validate("payroll", Map.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown record type: payroll");
    assertThatThrownBy(() -> service.fieldRules("payroll"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void exposesFieldRulesInEvaluationOrder() {
    Map<String, List<RuleDescriptor>> rules = service.fieldRules("cash-flow");

    assertThat(rules.keySet())
        .containsExactly("amount", "date", "flow_type", "direction", "description");
    assertThat(rules.values()).allSatisfy(fieldRules -> assertThat(fieldRules).isNotEmpty());
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThatThrownBy(() -> new RecordValidationService(List.of(
        new RentalDataValidator(fieldValidator), new RentalDataValidator(fieldValidator))))
        .isInstanceOf(IllegalStateException.class);
  }
}
