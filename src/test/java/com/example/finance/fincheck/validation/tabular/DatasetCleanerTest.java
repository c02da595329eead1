package com.example.finance.fincheck.validation.tabular;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatasetCleanerTest {

  private final DatasetCleaner cleaner = new DatasetCleaner(FieldValidator.withDefaults());

  private static Map<String, Object> row(Object amount, Object date) {
    Map<String, Object> row = new HashMap<>();
    row.put("amount", amount);
    row.put("date", date);
    return row;
  }

  @Test
  void replacesValidCellsAndKeepsInvalidOnes() {
    List<Map<String, Object>> rows = List.of(row("$1,200.50", "2024-04-01"), row("twelve", "04/02/2024"));
    Map<String, List<RuleDescriptor>> rules = new LinkedHashMap<>();
    rules.put("amount", List.of(RuleDescriptor.numeric()));
    rules.put("date", List.of(RuleDescriptor.date()));

    CleanedDataset result = cleaner.clean(rows, rules);

    assertThat(result.rows().get(0)).containsEntry("amount", 1200.5)
        .containsEntry("date", LocalDate.of(2024, 4, 1));
    assertThat(result.rows().get(1)).containsEntry("amount", "twelve")
        .containsEntry("date", LocalDate.of(2024, 4, 2));
    assertThat(rows.get(0)).containsEntry("amount", "$1,200.50");

    DatasetCleaningReport report = result.report();
    assertThat(report.getOriginalRows()).isEqualTo(2);
    assertThat(report.getFinalRows()).isEqualTo(2);
    assertThat(report.getColumnsProcessed()).containsExactly("amount", "date");
    assertThat(report.getErrors()).containsExactly("amount - Row 2: Invalid numeric value");
    assertThat(report.getCleaningActions()).containsExactly("Dataset contains 1 validation errors");
    assertThat(report.isSuccess()).isFalse();
  }

  @Test
  void unknownColumnIsReported() {
    CleanedDataset result = cleaner.clean(
        List.of(row(1, "2024-01-01")), Map.of("tax_id", List.of(RuleDescriptor.taxId())));

    assertThat(result.report().getErrors()).containsExactly("Column 'tax_id' not found in dataset");
    assertThat(result.report().getColumnsProcessed()).isEmpty();
  }

  @Test
  void warningsDoNotFailTheDataset() {
    CleanedDataset result = cleaner.clean(
        List.of(Map.of("rate", "120%")), Map.of("rate", List.of(RuleDescriptor.percentage())));

    assertThat(result.rows().get(0)).containsEntry("rate", 1.2);
    assertThat(result.report().getWarnings())
        .containsExactly("rate - Row 1: Percentage should be between 0% and 100%");
    assertThat(result.report().isSuccess()).isTrue();
  }
}
