package com.example.finance.fincheck.response;

import com.example.finance.fincheck.validation.RuleOutcome;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.List;
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
public class FieldValidationResponse {
  private boolean valid;
  private List<String> errors;
  private List<String> warnings;
  private Object cleanedValue;

  /** Per-rule outcomes; only filled by the trace endpoint. */
  private List<RuleOutcome> steps;

  public static FieldValidationResponse from(ValidationOutcome outcome, List<RuleOutcome> steps) {
    return FieldValidationResponse.builder()
        .valid(outcome.valid())
        .errors(outcome.errors())
        .warnings(outcome.warnings())
        .cleanedValue(outcome.cleanedValue())
        .steps(steps)
        .build();
  }
}
