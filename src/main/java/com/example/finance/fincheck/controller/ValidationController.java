package com.example.finance.fincheck.controller;

import com.example.finance.fincheck.request.DatasetCleaningRequest;
import com.example.finance.fincheck.request.FieldValidationRequest;
import com.example.finance.fincheck.request.LoanParametersRequest;
import com.example.finance.fincheck.request.NpvParametersRequest;
import com.example.finance.fincheck.request.RuleDescriptorRequest;
import com.example.finance.fincheck.request.WorksheetValidationRequest;
import com.example.finance.fincheck.response.FieldValidationResponse;
import com.example.finance.fincheck.response.RecordValidationResponse;
import com.example.finance.fincheck.response.ValidationEnvelope;
import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.RuleOutcome;
import com.example.finance.fincheck.validation.ValidationOutcome;
import com.example.finance.fincheck.validation.parameter.CalculationParameterValidator;
import com.example.finance.fincheck.validation.record.RecordValidationService;
import com.example.finance.fincheck.validation.tabular.CleanedDataset;
import com.example.finance.fincheck.validation.tabular.DatasetCleaner;
import com.example.finance.fincheck.validation.tabular.WorksheetValidationReport;
import com.example.finance.fincheck.validation.tabular.WorksheetValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/validation")
@Tag(name = "Validation", description = "Rule-based validation and cleaning of financial data")
@RequiredArgsConstructor
public class ValidationController {

    private final FieldValidator fieldValidator;
    private final RecordValidationService recordValidationService;
    private final CalculationParameterValidator parameterValidator;
    private final WorksheetValidator worksheetValidator;
    private final DatasetCleaner datasetCleaner;

    @PostMapping("/field")
    @Operation(
            summary = "Validate a single value",
            description = "Applies the rules in order and returns the merged outcome; the last rule that cleans the value wins."
    )
    public Mono<ResponseEntity<ValidationEnvelope<FieldValidationResponse>>> validateField(
            @Valid @RequestBody FieldValidationRequest request) {
        return respond(() -> {
            List<RuleDescriptor> rules = RuleDescriptorRequest.toDescriptors(request.getRules());
            ValidationOutcome outcome = fieldValidator.validateField(request.getValue(), rules);
            return FieldValidationResponse.from(outcome, null);
        });
    }

    @PostMapping("/field/trace")
    @Operation(summary = "Validate a single value and return every rule's own outcome")
    public Mono<ResponseEntity<ValidationEnvelope<FieldValidationResponse>>> traceField(
            @Valid @RequestBody FieldValidationRequest request) {
        return respond(() -> {
            List<RuleDescriptor> rules = RuleDescriptorRequest.toDescriptors(request.getRules());
            List<RuleOutcome> steps = fieldValidator.traceField(request.getValue(), rules);
            ValidationOutcome merged = ValidationOutcome.merge(steps.stream().map(RuleOutcome::outcome).toList());
            return FieldValidationResponse.from(merged, steps);
        });
    }

    @PostMapping("/records/{type}")
    @Operation(
            summary = "Validate a financial record",
            description = "Record types: financial-statement, rental, expense, cash-flow. Field names use snake_case."
    )
    public Mono<ResponseEntity<ValidationEnvelope<RecordValidationResponse>>> validateRecord(
            @PathVariable("type") String type, @RequestBody Map<String, Object> record) {
        return respond(() -> {
            Map<String, ValidationOutcome> results = recordValidationService.validate(type, record);
            return new RecordValidationResponse(type, RecordValidationService.allValid(results), results);
        });
    }

    @GetMapping("/records/{type}/rules")
    @Operation(summary = "List the per-field rules a record type applies")
    public Mono<ResponseEntity<ValidationEnvelope<Map<String, List<RuleDescriptorRequest>>>>> recordRules(
            @PathVariable("type") String type) {
        return respond(() -> RuleDescriptorRequest.fromColumnRules(recordValidationService.fieldRules(type)));
    }

    @PostMapping("/loan")
    @Operation(summary = "Check loan calculation inputs")
    public Mono<ResponseEntity<ValidationEnvelope<ValidationOutcome>>> validateLoan(
            @Valid @RequestBody LoanParametersRequest request) {
        return respond(() -> parameterValidator.validateLoan(
                request.principal(), request.annualRate(), request.years()));
    }

    @PostMapping("/npv")
    @Operation(summary = "Check NPV calculation inputs")
    public Mono<ResponseEntity<ValidationEnvelope<ValidationOutcome>>> validateNpv(
            @RequestBody NpvParametersRequest request) {
        return respond(() -> parameterValidator.validateNpv(request.rate(), request.cashFlows()));
    }

    @PostMapping("/worksheet")
    @Operation(summary = "Validate worksheet rows against expected columns and per-column rules")
    public Mono<ResponseEntity<ValidationEnvelope<WorksheetValidationReport>>> validateWorksheet(
            @Valid @RequestBody WorksheetValidationRequest request) {
        return respond(() -> worksheetValidator.validate(
                request.getRows(),
                request.getExpectedColumns() == null ? List.of() : request.getExpectedColumns(),
                RuleDescriptorRequest.toColumnRules(request.getColumnRules())));
    }

    @PostMapping("/dataset/clean")
    @Operation(summary = "Validate a dataset and substitute cleaned values")
    public Mono<ResponseEntity<ValidationEnvelope<CleanedDataset>>> cleanDataset(
            @Valid @RequestBody DatasetCleaningRequest request) {
        return respond(() -> datasetCleaner.clean(
                request.getRows(), RuleDescriptorRequest.toColumnRules(request.getColumnRules())));
    }

    private <T> Mono<ResponseEntity<ValidationEnvelope<T>>> respond(Supplier<T> work) {
        return Mono.fromSupplier(work)
                .map(body -> ResponseEntity.ok(ValidationEnvelope.of(body)))
                .onErrorResume(RuleConfigurationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(ValidationEnvelope.<T>failure(ex.getReasons()))))
                .onErrorResume(IllegalArgumentException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(ValidationEnvelope.<T>failure(List.of(describe(ex))))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while validating", ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(ValidationEnvelope.<T>failure(List.of(toUnexpectedMessage(ex)))));
                });
    }

    private static String describe(Throwable ex) {
        String detail = ex.getMessage();
        return (detail == null || detail.isBlank()) ? "Invalid request." : detail;
    }

    private static String toUnexpectedMessage(Throwable ex) {
        String detail = ex.getMessage();
        return (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
    }
}
