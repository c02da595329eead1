package com.example.finance.fincheck.request;

import java.util.List;

public record NpvParametersRequest(Double rate, List<Double> cashFlows) {
}
