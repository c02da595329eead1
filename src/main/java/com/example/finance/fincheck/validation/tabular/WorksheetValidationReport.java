package com.example.finance.fincheck.validation.tabular;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WorksheetValidationReport {

  /** Set when the worksheet could not be validated at all, e.g. it had no rows. */
  String error;

  @Builder.Default
  List<String> headerErrors = List.of();

  int totalRows;
  int totalErrors;
  int totalWarnings;

  @Builder.Default
  List<Integer> errorRows = List.of();

  @Builder.Default
  List<RowValidationResult> details = List.of();

  boolean valid;

  public static WorksheetValidationReport noData() {
    return WorksheetValidationReport.builder().error("No data provided").valid(false).build();
  }

  public static WorksheetValidationReport headerErrors(List<String> headerErrors) {
    return WorksheetValidationReport.builder()
        .headerErrors(List.copyOf(headerErrors))
        .valid(false)
        .build();
  }
}
