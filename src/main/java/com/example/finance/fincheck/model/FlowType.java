package com.example.finance.fincheck.model;

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Cash-flow statement section. */
@Getter
@RequiredArgsConstructor
public enum FlowType {
  OPERATING("Operating"),
  INVESTING("Investing"),
  FINANCING("Financing");

  private final String label;

  public static List<String> labels() {
    return Arrays.stream(values()).map(FlowType::getLabel).toList();
  }
}
