package com.example.finance.fincheck.validation.tabular;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Validates spreadsheet-shaped data whose first row holds the column headers. */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorksheetValidator {

  private final FieldValidator fieldValidator;

  public WorksheetValidationReport validate(
      List<List<Object>> rows,
      List<String> expectedColumns,
      Map<String, List<RuleDescriptor>> columnRules) {
    if (rows == null || rows.isEmpty()) {
      return WorksheetValidationReport.noData();
    }

    List<Object> headers = rows.get(0) == null ? List.of() : rows.get(0);
    List<String> headerErrors = new ArrayList<>();
    Map<String, Integer> columnIndices = new LinkedHashMap<>();
    for (String column : expectedColumns) {
      int index = headers.indexOf(column);
      if (index < 0) {
        headerErrors.add("Missing required column: " + column);
      } else {
        columnIndices.put(column, index);
      }
    }
    if (!headerErrors.isEmpty()) {
      log.debug("Worksheet rejected: {}", headerErrors);
      return WorksheetValidationReport.headerErrors(headerErrors);
    }

    List<RowValidationResult> details = new ArrayList<>(rows.size() - 1);
    for (int i = 1; i < rows.size(); i++) {
      details.add(validateRow(i + 1, rows.get(i), columnIndices, columnRules));
    }

    int totalErrors = details.stream().mapToInt(row -> row.errors().size()).sum();
    int totalWarnings = details.stream().mapToInt(row -> row.warnings().size()).sum();
    List<Integer> errorRows = details.stream()
        .filter(RowValidationResult::hasErrors)
        .map(RowValidationResult::row)
        .toList();

    return WorksheetValidationReport.builder()
        .totalRows(details.size())
        .totalErrors(totalErrors)
        .totalWarnings(totalWarnings)
        .errorRows(errorRows)
        .details(details)
        .valid(totalErrors == 0)
        .build();
  }

  private RowValidationResult validateRow(
      int rowNumber,
      List<Object> row,
      Map<String, Integer> columnIndices,
      Map<String, List<RuleDescriptor>> columnRules) {
    List<Object> cells = row == null ? List.of() : row;
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    columnIndices.forEach((column, index) -> {
      List<RuleDescriptor> rules = columnRules.getOrDefault(column, List.of());
      if (index >= cells.size() || rules.isEmpty()) {
        return;
      }
      ValidationOutcome outcome = fieldValidator.validateField(cells.get(index), rules);
      outcome.errors().forEach(error -> errors.add(column + ": " + error));
      outcome.warnings().forEach(warning -> warnings.add(column + ": " + warning));
    });
    return new RowValidationResult(rowNumber, errors, warnings);
  }
}
