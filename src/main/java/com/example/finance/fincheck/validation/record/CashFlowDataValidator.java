package com.example.finance.fincheck.validation.record;

import com.example.finance.fincheck.model.FlowDirection;
import com.example.finance.fincheck.model.FlowType;
import com.example.finance.fincheck.validation.FieldValidator;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CashFlowDataValidator implements RecordValidator {

  private static final Map<String, List<RuleDescriptor>> FIELD_RULES;

  static {
    Map<String, List<RuleDescriptor>> rules = new LinkedHashMap<>();
    rules.put("amount",
        List.of(RuleDescriptor.required(), RuleDescriptor.currency(), RuleDescriptor.positive()));
    rules.put("date", List.of(RuleDescriptor.required(), RuleDescriptor.date()));
    rules.put("flow_type", List.of(RuleDescriptor.required()));
    rules.put("direction", List.of(RuleDescriptor.required()));
    rules.put("description", List.of(RuleDescriptor.required(), RuleDescriptor.length(5, 200)));
    FIELD_RULES = Collections.unmodifiableMap(rules);
  }

  private final FieldValidator fieldValidator;

  @Override
  public String name() {
    return "cash-flow";
  }

  @Override
  public Map<String, List<RuleDescriptor>> fieldRules() {
    return FIELD_RULES;
  }

  @Override
  public Map<String, ValidationOutcome> validate(Map<String, ?> record) {
    Map<String, ?> source = record == null ? Map.of() : record;
    Map<String, ValidationOutcome> results = fieldValidator.validateRecord(source, FIELD_RULES);

    CrossFieldChecks.requireOneOf(source, results, "flow_type", FlowType.labels(),
        "Flow type must be one of: " + String.join(", ", FlowType.labels()));
    CrossFieldChecks.requireOneOf(source, results, "direction", FlowDirection.labels(),
        "Direction must be one of: " + String.join(", ", FlowDirection.labels()));
    return results;
  }
}
