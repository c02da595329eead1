package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Looks up registered {@link RecordValidator} beans by name and runs them. */
@Slf4j
@Service
public class RecordValidationService {

  private final Map<String, RecordValidator> validatorsByName;

  public RecordValidationService(List<RecordValidator> validators) {
    List<RecordValidator> safeValidators = validators == null ? List.of() : validators;
    Map<String, RecordValidator> byName = new LinkedHashMap<>();
    for (RecordValidator validator : safeValidators) {
      if (validator == null) {
        continue;
      }
      RecordValidator previous = byName.putIfAbsent(validator.name(), validator);
      if (previous != null) {
        throw new IllegalStateException("Duplicate record validator name: " + validator.name());
      }
    }
    this.validatorsByName = Map.copyOf(byName);
  }

  public Set<String> names() {
    return validatorsByName.keySet();
  }

  /** The per-field rules the named record type applies, in evaluation order. */
  public Map<String, List<RuleDescriptor>> fieldRules(String name) {
    return lookup(name).fieldRules();
  }

  public Map<String, ValidationOutcome> validate(String name, Map<String, ?> record) {
    Map<String, ValidationOutcome> results = lookup(name).validate(record);
    if (log.isDebugEnabled()) {
      long failed = results.values().stream().filter(outcome -> !outcome.valid()).count();
      log.debug("Validated {} record: {} outcomes, {} failed", name, results.size(), failed);
    }
    return results;
  }

  private RecordValidator lookup(String name) {
    RecordValidator validator = validatorsByName.get(Objects.requireNonNull(name, "name"));
    if (validator == null) {
      throw new IllegalArgumentException("Unknown record type: " + name);
    }
    return validator;
  }

  /** True when every outcome is valid. */
  public static boolean allValid(Map<String, ValidationOutcome> results) {
    return results.values().stream().allMatch(ValidationOutcome::valid);
  }
}
