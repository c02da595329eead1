package com.example.finance.fincheck.request;

import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class DatasetCleaningRequest {
  private List<Map<String, Object>> rows;
  private Map<String, List<@Valid RuleDescriptorRequest>> columnRules;
}
