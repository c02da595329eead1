package com.example.finance.fincheck.validation.tabular;

import java.util.List;
import java.util.Map;

/** Rows with cleaned values substituted, alongside the report describing what happened. */
public record CleanedDataset(List<Map<String, Object>> rows, DatasetCleaningReport report) {}
