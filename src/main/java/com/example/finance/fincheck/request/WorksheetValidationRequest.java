package com.example.finance.fincheck.request;

import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/** Worksheet rows (first row = headers), the columns that must exist and the rules per column. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class WorksheetValidationRequest {
  private List<List<Object>> rows;
  private List<String> expectedColumns;
  private Map<String, List<@Valid RuleDescriptorRequest>> columnRules;
}
