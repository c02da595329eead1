package com.example.finance.fincheck.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.finance.fincheck.request.FieldValidationRequest;
import com.example.finance.fincheck.request.LoanParametersRequest;
import com.example.finance.fincheck.request.RuleDescriptorRequest;
import com.example.finance.fincheck.response.FieldValidationResponse;
import com.example.finance.fincheck.response.RecordValidationResponse;
import com.example.finance.fincheck.response.ValidationEnvelope;
import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import com.example.finance.fincheck.validation.parameter.CalculationParameterValidator;
import com.example.finance.fincheck.validation.record.CashFlowDataValidator;
import com.example.finance.fincheck.validation.record.ExpenseDataValidator;
import com.example.finance.fincheck.validation.record.FinancialStatementValidator;
import com.example.finance.fincheck.validation.record.RecordValidationService;
import com.example.finance.fincheck.validation.record.RentalDataValidator;
import com.example.finance.fincheck.validation.tabular.DatasetCleaner;
import com.example.finance.fincheck.validation.tabular.WorksheetValidator;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class ValidationControllerTest {

  private final FieldValidator fieldValidator = FieldValidator.withDefaults();

  private ValidationController newController(FieldValidator validator) {
    RecordValidationService records = new RecordValidationService(List.of(
        new FinancialStatementValidator(fieldValidator),
        new RentalDataValidator(fieldValidator),
        new ExpenseDataValidator(fieldValidator),
        new CashFlowDataValidator(fieldValidator)));
    return new ValidationController(
        validator,
        records,
        new CalculationParameterValidator(fieldValidator),
        new WorksheetValidator(fieldValidator),
        new DatasetCleaner(fieldValidator));
  }

  @Test
  void validateFieldReturnsMergedOutcome() {
    FieldValidationRequest request = FieldValidationRequest.builder()
        .value("$1,234.56")
        .rules(List.of(
            new RuleDescriptorRequest(ValidationRuleKind.REQUIRED, null, null, null),
            new RuleDescriptorRequest(ValidationRuleKind.RANGE, Map.of("max", 1000), null, null)))
        .build();

    ResponseEntity<ValidationEnvelope<FieldValidationResponse>> response =
        newController(fieldValidator).validateField(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(200);
    FieldValidationResponse body = response.getBody().getData();
    assertThat(body.isValid()).isFalse();
    assertThat(body.getErrors()).containsExactly("Value must not exceed 1000");
    assertThat(body.getCleanedValue()).isNull();
    assertThat(body.getSteps()).isNull();
  }

  @Test
  void traceFieldReturnsSteps() {
    FieldValidationRequest request = FieldValidationRequest.builder()
        .value("25%")
        .rules(List.of(new RuleDescriptorRequest(ValidationRuleKind.PERCENTAGE, null, null, null)))
        .build();

    FieldValidationResponse body =
        newController(fieldValidator).traceField(request).block().getBody().getData();

    assertThat(body.getCleanedValue()).isEqualTo(0.25);
    assertThat(body.getSteps()).hasSize(1);
  }

  @Test
  void malformedRuleParametersReturnBadRequest() {
    FieldValidationRequest request = FieldValidationRequest.builder()
        .value(5)
        .rules(List.of(new RuleDescriptorRequest(ValidationRuleKind.LENGTH, Map.of("min", "five"), null, null)))
        .build();

    ResponseEntity<ValidationEnvelope<FieldValidationResponse>> response =
        newController(fieldValidator).validateField(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().getData()).isNull();
    assertThat(response.getBody().getErrors())
        .containsExactly("LENGTH parameter 'min' must be a number but was String");
  }

  @Test
  void nullRuleEntryReturnsBadRequest() {
    FieldValidationRequest request = FieldValidationRequest.builder()
        .value("x")
        .rules(Arrays.asList(new RuleDescriptorRequest(ValidationRuleKind.REQUIRED, null, null, null), null))
        .build();

    ResponseEntity<ValidationEnvelope<FieldValidationResponse>> response =
        newController(fieldValidator).validateField(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().getErrors()).containsExactly("Rule at position 1 is null");
  }

  @Test
  void missingRuleKindReturnsBadRequest() {
    FieldValidationRequest request = FieldValidationRequest.builder()
        .value("x")
        .rules(List.of(new RuleDescriptorRequest(null, null, null, null)))
        .build();

    ResponseEntity<ValidationEnvelope<FieldValidationResponse>> response =
        newController(fieldValidator).validateField(request).block();

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().getErrors()).containsExactly("Rule kind is required");
  }

  @Test
  void recordRulesEndpointListsFieldRules() {
    ResponseEntity<ValidationEnvelope<Map<String, List<RuleDescriptorRequest>>>> response =
        newController(fieldValidator).recordRules("expense").block();

    assertThat(response).isNotNull();
    Map<String, List<RuleDescriptorRequest>> rules = response.getBody().getData();
    assertThat(rules).containsOnlyKeys(
        "amount", "date", "vendor_id", "category", "invoice_number", "description");
    assertThat(rules.get("amount")).extracting(RuleDescriptorRequest::kind).containsExactly(
        ValidationRuleKind.REQUIRED, ValidationRuleKind.CURRENCY, ValidationRuleKind.POSITIVE);
    assertThat(rules.get("vendor_id").get(1).parameters()).containsEntry("min", 1).containsEntry("max", 50);
  }

  @Test
  void recordEndpointRunsCrossFieldChecks() {
    ResponseEntity<ValidationEnvelope<RecordValidationResponse>> response = newController(fieldValidator)
        .validateRecord("rental", Map.of(
            "monthly_rent", "$1,500.00",
            "lease_start_date", "2024-01-01",
            "lease_end_date", "2023-12-31"))
        .block();

    assertThat(response).isNotNull();
    RecordValidationResponse body = response.getBody().getData();
    assertThat(body.valid()).isFalse();
    assertThat(body.fields().get("date_range").errors())
        .containsExactly("Lease start date must be before end date");
  }

  @Test
  void unknownRecordTypeReturnsBadRequest() {
    ResponseEntity<ValidationEnvelope<RecordValidationResponse>> response =
        newController(fieldValidator).validateRecord("payroll", Map.of()).block();

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().getErrors()).containsExactly("Unknown record type: payroll");
  }

  @Test
  void loanEndpointReturnsOutcome() {
    ValidationOutcome outcome = newController(fieldValidator)
        .validateLoan(new LoanParametersRequest(-5.0, 0.05, 10))
        .block()
        .getBody()
        .getData();

    assertThat(outcome.errors()).containsExactly("Value must be positive");
  }

  @Test
  void unexpectedErrorsReturnServerError() {
    FieldValidator broken = mock(FieldValidator.class);
    when(broken.validateField(any(), anyList())).thenThrow(new IllegalStateException("boom"));
    FieldValidationRequest request = FieldValidationRequest.builder()
        .value("x")
        .rules(List.of())
        .build();

    ResponseEntity<ValidationEnvelope<FieldValidationResponse>> response =
        newController(broken).validateField(request).block();

    assertThat(response).isNotNull();
    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(response.getBody().getErrors()).containsExactly("Unexpected error: boom");
  }
}
