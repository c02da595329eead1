package com.example.finance.fincheck.validation;

import com.example.finance.fincheck.config.ValidationProperties;
import com.example.finance.fincheck.validation.rule.CurrencyRule;
import com.example.finance.fincheck.validation.rule.CustomRule;
import com.example.finance.fincheck.validation.rule.DateRule;
import com.example.finance.fincheck.validation.rule.EmailRule;
import com.example.finance.fincheck.validation.rule.FieldRule;
import com.example.finance.fincheck.validation.rule.LengthRule;
import com.example.finance.fincheck.validation.rule.NumericRule;
import com.example.finance.fincheck.validation.rule.PercentageRule;
import com.example.finance.fincheck.validation.rule.PhoneRule;
import com.example.finance.fincheck.validation.rule.RangeRule;
import com.example.finance.fincheck.validation.rule.RegexRule;
import com.example.finance.fincheck.validation.rule.RequiredRule;
import com.example.finance.fincheck.validation.rule.SignRule;
import com.example.finance.fincheck.validation.rule.TaxIdRule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Interprets an ordered list of {@link RuleDescriptor}s against a single value.
 *
 * <p>Every rule sees the original value, all errors and warnings are reported, and the merged
 * cleaned value is the one produced by the last rule that cleaned anything. Absent values (null
 * or the empty string) pass every rule except REQUIRED.
 */
@Service
public class FieldValidator {

  private final Map<ValidationRuleKind, FieldRule> handlers;

  public FieldValidator(ValidationProperties properties) {
    NumericRule numeric = new NumericRule(List.copyOf(properties.getCurrencySymbols()));
    this.handlers = register(List.of(
        new RequiredRule(),
        numeric,
        SignRule.positive(numeric),
        SignRule.negative(numeric),
        new PercentageRule(numeric),
        new CurrencyRule(),
        new DateRule(List.copyOf(properties.getDateFormats())),
        new EmailRule(),
        new PhoneRule(List.copyOf(properties.getPhonePatterns())),
        new TaxIdRule(),
        new RangeRule(numeric),
        new LengthRule(),
        new RegexRule(),
        new CustomRule()));
  }

  /** Validator with the built-in currency symbols, phone patterns and date formats. */
  public static FieldValidator withDefaults() {
    return new FieldValidator(new ValidationProperties());
  }

  public ValidationOutcome validateField(Object value, List<RuleDescriptor> rules) {
    return ValidationOutcome.merge(traceField(value, rules).stream().map(RuleOutcome::outcome).toList());
  }

  /** Applies each rule in order and returns the individual outcomes without merging them. */
  public List<RuleOutcome> traceField(Object value, List<RuleDescriptor> rules) {
    if (rules == null || rules.isEmpty()) {
      return List.of();
    }
    List<RuleOutcome> outcomes = new ArrayList<>(rules.size());
    for (int i = 0; i < rules.size(); i++) {
      RuleDescriptor rule = rules.get(i);
      if (rule == null) {
        throw new RuleConfigurationException("Rule at position " + i + " is null");
      }
      outcomes.add(new RuleOutcome(rule.getKind(), apply(value, rule)));
    }
    return outcomes;
  }

  /**
   * Validates each configured field of a record independently. A field is checked when the
   * record has its key or when its rules contain REQUIRED; a missing key then reads as null.
   */
  public Map<String, ValidationOutcome> validateRecord(
      Map<String, ?> record, Map<String, List<RuleDescriptor>> fieldRules) {
    Map<String, ?> source = record == null ? Map.of() : record;
    Map<String, ValidationOutcome> results = new LinkedHashMap<>();
    fieldRules.forEach((field, rules) -> {
      if (source.containsKey(field) || isRequired(rules)) {
        results.put(field, validateField(source.get(field), rules));
      }
    });
    return results;
  }

  private ValidationOutcome apply(Object value, RuleDescriptor rule) {
    FieldRule handler = handlers.get(rule.getKind());
    handler.checkParameters(rule);
    if (rule.getKind() != ValidationRuleKind.REQUIRED && isAbsent(value)) {
      return ValidationOutcome.passed();
    }
    return handler.apply(value, rule);
  }

  private static Map<ValidationRuleKind, FieldRule> register(List<FieldRule> rules) {
    Map<ValidationRuleKind, FieldRule> byKind = new EnumMap<>(ValidationRuleKind.class);
    for (FieldRule rule : rules) {
      if (byKind.put(rule.kind(), rule) != null) {
        throw new IllegalStateException("Duplicate handler for " + rule.kind());
      }
    }
    EnumSet<ValidationRuleKind> missing = EnumSet.complementOf(EnumSet.copyOf(byKind.keySet()));
    if (!missing.isEmpty()) {
      throw new IllegalStateException("No handler for " + missing);
    }
    return Collections.unmodifiableMap(byKind);
  }

  static boolean isAbsent(Object value) {
    return value == null || (value instanceof String text && text.isEmpty());
  }

  private static boolean isRequired(List<RuleDescriptor> rules) {
    return rules.stream().anyMatch(rule -> rule.getKind() == ValidationRuleKind.REQUIRED);
  }
}
