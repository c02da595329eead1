package com.example.finance.fincheck.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidationOutcomeTest {

  @Test
  void mergeConcatenatesInOrderAndKeepsLastCleanedValue() {
    ValidationOutcome merged = ValidationOutcome.merge(List.of(
        ValidationOutcome.cleaned(1.0),
        ValidationOutcome.failed("first"),
        ValidationOutcome.warned("careful", 2.0),
        ValidationOutcome.passed(),
        ValidationOutcome.failed("second")));

    assertThat(merged.valid()).isFalse();
    assertThat(merged.errors()).containsExactly("first", "second");
    assertThat(merged.warnings()).containsExactly("careful");
    assertThat(merged.cleanedValue()).isEqualTo(2.0);
  }

  @Test
  void validityMustMatchErrors() {
    assertThatThrownBy(() -> new ValidationOutcome(true, List.of("boom"), List.of(), null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ValidationOutcome(false, List.of(), List.of(), null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withErrorProducesNewFailedOutcome() {
    ValidationOutcome original = ValidationOutcome.cleaned("x");
    ValidationOutcome failed = original.withError("bad");

    assertThat(original.valid()).isTrue();
    assertThat(failed.valid()).isFalse();
    assertThat(failed.errors()).containsExactly("bad");
    assertThat(failed.cleanedValue()).isEqualTo("x");
  }
}
