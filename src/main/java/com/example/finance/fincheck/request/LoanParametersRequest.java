package com.example.finance.fincheck.request;

import jakarta.validation.constraints.NotNull;

public record LoanParametersRequest(
        Double principal,
        @NotNull(message = "annualRate is required") Double annualRate,
        @NotNull(message = "years is required") Integer years
) {
}
