package com.example.finance.fincheck.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Declarative description of one rule to apply to a field value. Immutable.
 *
 * <p>Rule-specific parameters: {@code min}/{@code max} for {@link ValidationRuleKind#RANGE} and
 * {@link ValidationRuleKind#LENGTH}, {@code pattern} for {@link ValidationRuleKind#REGEX}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RuleDescriptor {

  public static final String MIN = "min";
  public static final String MAX = "max";
  public static final String PATTERN = "pattern";

  private final ValidationRuleKind kind;
  private final Map<String, Object> parameters;
  private final String errorMessage;
  private final String warningMessage;
  @ToString.Exclude
  private final CustomRuleCheck customCheck;

  private RuleDescriptor(
      ValidationRuleKind kind,
      Map<String, Object> parameters,
      String errorMessage,
      String warningMessage,
      CustomRuleCheck customCheck) {
    if (kind == null) {
      throw new RuleConfigurationException("Rule kind is required");
    }
    this.kind = kind;
    this.parameters = parameters == null || parameters.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.errorMessage = errorMessage;
    this.warningMessage = warningMessage;
    this.customCheck = customCheck;
  }

  public static RuleDescriptor of(ValidationRuleKind kind) {
    return new RuleDescriptor(kind, null, null, null, null);
  }

  public static RuleDescriptor of(ValidationRuleKind kind, Map<String, Object> parameters) {
    return new RuleDescriptor(kind, parameters, null, null, null);
  }

  public static RuleDescriptor of(
      ValidationRuleKind kind,
      Map<String, Object> parameters,
      String errorMessage,
      String warningMessage) {
    return new RuleDescriptor(kind, parameters, errorMessage, warningMessage, null);
  }

  public static RuleDescriptor required() {
    return of(ValidationRuleKind.REQUIRED);
  }

  public static RuleDescriptor numeric() {
    return of(ValidationRuleKind.NUMERIC);
  }

  public static RuleDescriptor positive() {
    return of(ValidationRuleKind.POSITIVE);
  }

  public static RuleDescriptor negative() {
    return of(ValidationRuleKind.NEGATIVE);
  }

  public static RuleDescriptor percentage() {
    return of(ValidationRuleKind.PERCENTAGE);
  }

  public static RuleDescriptor currency() {
    return of(ValidationRuleKind.CURRENCY);
  }

  public static RuleDescriptor date() {
    return of(ValidationRuleKind.DATE);
  }

  public static RuleDescriptor email() {
    return of(ValidationRuleKind.EMAIL);
  }

  public static RuleDescriptor phone() {
    return of(ValidationRuleKind.PHONE);
  }

  public static RuleDescriptor taxId() {
    return of(ValidationRuleKind.TAX_ID);
  }

  /** Either bound may be {@code null}. */
  public static RuleDescriptor range(Number min, Number max) {
    return of(ValidationRuleKind.RANGE, bounds(min, max));
  }

  /** Either bound may be {@code null}; defaults are 0 and unbounded. */
  public static RuleDescriptor length(Integer min, Integer max) {
    return of(ValidationRuleKind.LENGTH, bounds(min, max));
  }

  public static RuleDescriptor regex(String pattern) {
    return of(ValidationRuleKind.REGEX, Map.of(PATTERN, Objects.requireNonNull(pattern, "pattern")));
  }

  public static RuleDescriptor custom(CustomRuleCheck check) {
    return new RuleDescriptor(
        ValidationRuleKind.CUSTOM, null, null, null, Objects.requireNonNull(check, "check"));
  }

  /** Returns a copy carrying the given error message override. */
  public RuleDescriptor withErrorMessage(String message) {
    return new RuleDescriptor(kind, parameters, message, warningMessage, customCheck);
  }

  /** Returns a copy carrying the given warning message override. */
  public RuleDescriptor withWarningMessage(String message) {
    return new RuleDescriptor(kind, parameters, errorMessage, message, customCheck);
  }

  public Object parameter(String name) {
    return parameters.get(name);
  }

  /** The error message override, or {@code fallback} when none was configured. */
  public String errorOr(String fallback) {
    return errorMessage != null ? errorMessage : fallback;
  }

  /** The warning message override, or {@code fallback} when none was configured. */
  public String warningOr(String fallback) {
    return warningMessage != null ? warningMessage : fallback;
  }

  private static Map<String, Object> bounds(Number min, Number max) {
    Map<String, Object> params = new LinkedHashMap<>();
    if (min != null) {
      params.put(MIN, min);
    }
    if (max != null) {
      params.put(MAX, max);
    }
    return params;
  }
}
