package com.example.finance.fincheck.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result of applying one or more rules to a value.
 *
 * <p>{@code valid} always equals {@code errors.isEmpty()}; the canonical constructor rejects
 * anything else.
 */
public record ValidationOutcome(
    boolean valid, List<String> errors, List<String> warnings, Object cleanedValue) {

  private static final ValidationOutcome PASSED = new ValidationOutcome(true, List.of(), List.of(), null);

  public ValidationOutcome {
    errors = errors == null ? List.of() : List.copyOf(errors);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    if (valid != errors.isEmpty()) {
      throw new IllegalArgumentException("valid must be true exactly when there are no errors");
    }
  }

  public static ValidationOutcome passed() {
    return PASSED;
  }

  public static ValidationOutcome cleaned(Object cleanedValue) {
    return new ValidationOutcome(true, List.of(), List.of(), cleanedValue);
  }

  public static ValidationOutcome failed(String error) {
    return new ValidationOutcome(false, List.of(Objects.requireNonNull(error, "error")), List.of(), null);
  }

  public static ValidationOutcome warned(String warning, Object cleanedValue) {
    return new ValidationOutcome(
        true, List.of(), List.of(Objects.requireNonNull(warning, "warning")), cleanedValue);
  }

  public static ValidationOutcome of(List<String> errors, List<String> warnings) {
    return new ValidationOutcome(errors == null || errors.isEmpty(), errors, warnings, null);
  }

  /** Returns a copy with the given error appended. */
  public ValidationOutcome withError(String error) {
    List<String> merged = new ArrayList<>(errors);
    merged.add(Objects.requireNonNull(error, "error"));
    return new ValidationOutcome(false, merged, warnings, cleanedValue);
  }

  /** Returns a copy with the given warning appended. */
  public ValidationOutcome withWarning(String warning) {
    List<String> merged = new ArrayList<>(warnings);
    merged.add(Objects.requireNonNull(warning, "warning"));
    return new ValidationOutcome(valid, errors, merged, cleanedValue);
  }

  /**
   * Folds per-rule outcomes in order: errors and warnings are concatenated and the last non-null
   * cleaned value wins.
   */
  public static ValidationOutcome merge(List<ValidationOutcome> outcomes) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    Object cleanedValue = null;
    for (ValidationOutcome outcome : outcomes) {
      errors.addAll(outcome.errors());
      warnings.addAll(outcome.warnings());
      if (outcome.cleanedValue() != null) {
        cleanedValue = outcome.cleanedValue();
      }
    }
    return new ValidationOutcome(errors.isEmpty(), errors, warnings, cleanedValue);
  }
}
