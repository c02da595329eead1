package com.example.finance.fincheck.validation;

/** Closed set of rule kinds understood by the {@link FieldValidator}. */
public enum ValidationRuleKind {
  REQUIRED,
  NUMERIC,
  POSITIVE,
  NEGATIVE,
  PERCENTAGE,
  CURRENCY,
  DATE,
  EMAIL,
  PHONE,
  TAX_ID,
  RANGE,
  LENGTH,
  REGEX,
  /** Delegates to a caller-supplied {@link CustomRuleCheck}; passes through when none is set. */
  CUSTOM
}
