package com.example.finance.fincheck.validation;

/** Outcome of a single descriptor, as recorded by {@link FieldValidator#traceField}. */
public record RuleOutcome(ValidationRuleKind kind, ValidationOutcome outcome) {}
