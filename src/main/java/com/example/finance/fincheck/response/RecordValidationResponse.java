package com.example.finance.fincheck.response;

import com.example.finance.fincheck.validation.ValidationOutcome;
import java.util.Map;

/** Outcomes of a record validation keyed by field or cross-field check name. */
public record RecordValidationResponse(
        String recordType,
        boolean valid,
        Map<String, ValidationOutcome> fields
) {
}
