package com.example.finance.fincheck.validation.rule;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

class PercentageRuleTest {

  private final PercentageRule rule = new PercentageRule(new NumericRule(List.of("$")));

  @Test
  void percentSignScalesToFraction() {
    ValidationOutcome outcome = rule.apply("12.5%", RuleDescriptor.percentage());

    assertThat(outcome.valid()).isTrue();
    assertThat(outcome.cleanedValue()).isEqualTo(0.125);
  }

  @Test
  void outOfRangeWarnsWithDefaultMessage() {
    ValidationOutcome outcome = rule.apply("150%", RuleDescriptor.percentage());

    assertThat(outcome.valid()).isTrue();
    assertThat(outcome.warnings()).containsExactly("Percentage should be between 0% and 100%");
    assertThat(outcome.cleanedValue()).isEqualTo(1.5);
  }

  @Test
  void warningOverrideReplacesDefault() {
    RuleDescriptor descriptor =
        RuleDescriptor.percentage().withWarningMessage("Occupancy above 100% looks wrong");

    ValidationOutcome outcome = rule.apply(1.2, descriptor);

    assertThat(outcome.valid()).isTrue();
    assertThat(outcome.warnings()).containsExactly("Occupancy above 100% looks wrong");
  }
}
