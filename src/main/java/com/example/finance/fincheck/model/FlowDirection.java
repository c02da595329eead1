package com.example.finance.fincheck.model;

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FlowDirection {
  INFLOW("Inflow"),
  OUTFLOW("Outflow");

  private final String label;

  public static List<String> labels() {
    return Arrays.stream(values()).map(FlowDirection::getLabel).toList();
  }
}
