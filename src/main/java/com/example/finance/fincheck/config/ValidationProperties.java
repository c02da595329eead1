package com.example.finance.fincheck.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tunables for the field rules. The validators copy these lists at construction, so later
 * changes to a bound instance do not leak into running validators.
 */
@ConfigurationProperties(prefix = "fincheck.validation")
@Validated
public class ValidationProperties {

    private final List<String> currencySymbols = new ArrayList<>(List.of("$", "€", "£", "¥", "₹"));

    private final List<String> phonePatterns = new ArrayList<>(List.of(
            // US
            "^\\+?1?[-.\\s]?\\(?([0-9]{3})\\)?[-.\\s]?([0-9]{3})[-.\\s]?([0-9]{4})$",
            // international
            "^\\+?([0-9]{1,4})[-.\\s]?([0-9]{3,4})[-.\\s]?([0-9]{3,4})[-.\\s]?([0-9]{3,4})$"
    ));

    /** {@link java.time.format.DateTimeFormatter} patterns tried in order by the DATE rule. */
    private final List<String> dateFormats = new ArrayList<>(List.of(
            "uuuu-M-d",
            "M/d/uuuu",
            "d/M/uuuu",
            "uuuu-M-d H:m:s"
    ));

    public List<String> getCurrencySymbols() {
        return currencySymbols;
    }

    public void setCurrencySymbols(List<String> currencySymbols) {
        this.currencySymbols.clear();
        if (currencySymbols != null) {
            this.currencySymbols.addAll(currencySymbols);
        }
    }

    public List<String> getPhonePatterns() {
        return phonePatterns;
    }

    public void setPhonePatterns(List<String> phonePatterns) {
        this.phonePatterns.clear();
        if (phonePatterns != null) {
            this.phonePatterns.addAll(phonePatterns);
        }
    }

    public List<String> getDateFormats() {
        return dateFormats;
    }

    public void setDateFormats(List<String> dateFormats) {
        this.dateFormats.clear();
        if (dateFormats != null) {
            this.dateFormats.addAll(dateFormats);
        }
    }
}
