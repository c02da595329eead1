package com.example.finance.fincheck.request;

import com.example.finance.fincheck.validation.RuleConfigurationException;
import com.example.finance.fincheck.validation.RuleDescriptor;
import com.example.finance.fincheck.validation.ValidationRuleKind;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link RuleDescriptor}. CUSTOM has no wire representation for its check, so a
 * CUSTOM rule sent over HTTP always passes.
 */
public record RuleDescriptorRequest(
        @NotNull(message = "Rule kind is required") ValidationRuleKind kind,
        Map<String, Object> parameters,
        String errorMessage,
        String warningMessage
) {

    public RuleDescriptor toDescriptor() {
        return RuleDescriptor.of(kind, parameters, errorMessage, warningMessage);
    }

    public static RuleDescriptorRequest from(RuleDescriptor descriptor) {
        return new RuleDescriptorRequest(
                descriptor.getKind(),
                descriptor.getParameters(),
                descriptor.getErrorMessage(),
                descriptor.getWarningMessage());
    }

    public static List<RuleDescriptor> toDescriptors(List<RuleDescriptorRequest> requests) {
        if (requests == null) {
            return List.of();
        }
        List<RuleDescriptor> descriptors = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            RuleDescriptorRequest request = requests.get(i);
            if (request == null) {
                throw new RuleConfigurationException("Rule at position " + i + " is null");
            }
            descriptors.add(request.toDescriptor());
        }
        return descriptors;
    }

    public static Map<String, List<RuleDescriptorRequest>> fromColumnRules(
            Map<String, List<RuleDescriptor>> rules) {
        Map<String, List<RuleDescriptorRequest>> requests = new LinkedHashMap<>();
        rules.forEach((column, columnRules) ->
                requests.put(column, columnRules.stream().map(RuleDescriptorRequest::from).toList()));
        return requests;
    }

    public static Map<String, List<RuleDescriptor>> toColumnRules(
            Map<String, List<RuleDescriptorRequest>> requests) {
        Map<String, List<RuleDescriptor>> rules = new LinkedHashMap<>();
        if (requests != null) {
            requests.forEach((column, columnRules) -> rules.put(column, toDescriptors(columnRules)));
        }
        return rules;
    }
}
