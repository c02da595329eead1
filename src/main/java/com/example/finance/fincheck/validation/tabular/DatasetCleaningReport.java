package com.example.finance.fincheck.validation.tabular;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DatasetCleaningReport {
  int originalRows;
  List<String> columnsProcessed;
  List<String> cleaningActions;
  List<String> errors;
  List<String> warnings;
  int finalRows;
  boolean success;
}
