package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.List;
import java.util.Map;

/**
 * Validates one kind of financial record: a fixed field-to-rules configuration plus cross-field
 * checks that add extra named outcomes.
 */
public interface RecordValidator {

  /** Short identifier, e.g. {@code "rental"}. */
  String name();

  /** The per-field rules in evaluation order. */
  Map<String, List<RuleDescriptor>> fieldRules();

  /** Returns outcomes keyed by field name, followed by the cross-field check outcomes. */
  Map<String, ValidationOutcome> validate(Map<String, ?> record);
}
