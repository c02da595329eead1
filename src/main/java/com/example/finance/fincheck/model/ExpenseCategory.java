package com.example.finance.fincheck.model;

import java.util.Arrays;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Accepted expense categories, identified by their display label. */
@Getter
@RequiredArgsConstructor
public enum ExpenseCategory {
  RENT_LEASE("Rent/Lease"),
  UTILITIES("Utilities"),
  SALARIES_WAGES("Salaries & Wages"),
  EMPLOYEE_BENEFITS("Employee Benefits"),
  INSURANCE("Insurance"),
  MARKETING_ADVERTISING("Marketing & Advertising"),
  OFFICE_SUPPLIES("Office Supplies"),
  MAINTENANCE_REPAIRS("Maintenance & Repairs"),
  PROFESSIONAL_FEES("Professional Fees"),
  TRAVEL_ENTERTAINMENT("Travel & Entertainment"),
  RAW_MATERIALS("Raw Materials"),
  INVENTORY_PURCHASES("Inventory Purchases"),
  FREIGHT_SHIPPING("Freight & Shipping"),
  EQUIPMENT("Equipment"),
  PROPERTY("Property"),
  VEHICLES("Vehicles"),
  SOFTWARE("Software"),
  INTEREST_EXPENSE("Interest Expense"),
  BANK_FEES("Bank Fees"),
  TAXES("Taxes"),
  DEPRECIATION("Depreciation"),
  AMORTIZATION("Amortization"),
  OTHER("Other");

  private final String label;

  public static List<String> labels() {
    return Arrays.stream(values()).map(ExpenseCategory::getLabel).toList();
  }
}
