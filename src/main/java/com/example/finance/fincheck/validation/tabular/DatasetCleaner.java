package com.example.finance.fincheck.validation.tabular;

import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Validates a dataset column by column and replaces each valid cell with its cleaned value.
 * Invalid cells keep their original value and are listed in the report. The input rows are
 * copied, never modified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetCleaner {

  private final FieldValidator fieldValidator;

  public CleanedDataset clean(
      List<Map<String, Object>> rows, Map<String, List<RuleDescriptor>> columnRules) {
    List<Map<String, Object>> source = rows == null ? List.of() : rows;
    List<Map<String, Object>> cleaned = new ArrayList<>(source.size());
    Set<String> columns = new LinkedHashSet<>();
    for (Map<String, Object> row : source) {
      Map<String, Object> copy = row == null ? new LinkedHashMap<>() : new LinkedHashMap<>(row);
      columns.addAll(copy.keySet());
      cleaned.add(copy);
    }

    List<String> columnsProcessed = new ArrayList<>();
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    columnRules.forEach((column, rules) -> {
      if (!columns.contains(column)) {
        errors.add("Column '%s' not found in dataset".formatted(column));
        return;
      }
      columnsProcessed.add(column);
      for (int i = 0; i < cleaned.size(); i++) {
        Map<String, Object> row = cleaned.get(i);
        Object value = row.get(column);
        ValidationOutcome outcome = fieldValidator.validateField(value, rules);
        int rowNumber = i + 1;
        if (outcome.valid()) {
          if (outcome.cleanedValue() != null) {
            row.put(column, outcome.cleanedValue());
          }
        } else {
          errors.add("%s - Row %d: %s".formatted(column, rowNumber, String.join(", ", outcome.errors())));
        }
        outcome.warnings().forEach(warning ->
            warnings.add("%s - Row %d: %s".formatted(column, rowNumber, warning)));
      }
    });

    List<String> actions = new ArrayList<>();
    if (!errors.isEmpty()) {
      actions.add("Dataset contains %d validation errors".formatted(errors.size()));
      log.debug("Dataset cleaning found {} errors across {} rows", errors.size(), cleaned.size());
    }

    DatasetCleaningReport report = DatasetCleaningReport.builder()
        .originalRows(source.size())
        .columnsProcessed(List.copyOf(columnsProcessed))
        .cleaningActions(List.copyOf(actions))
        .errors(List.copyOf(errors))
        .warnings(List.copyOf(warnings))
        .finalRows(cleaned.size())
        .success(errors.isEmpty())
        .build();
    return new CleanedDataset(cleaned, report);
  }
}
