package com.example.finance.fincheck.validation.tabular;

import java.util.List;

/**
 * Problems found in one worksheet row. {@code row} is the spreadsheet row number, so the first
 * data row below the header is 2.
 */
public record RowValidationResult(int row, List<String> errors, List<String> warnings) {

  public RowValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }
}
