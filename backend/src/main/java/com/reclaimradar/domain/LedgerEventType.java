package com.reclaimradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Event types reported in the inventory ledger detail report. {@link #reportValue()} is the literal
 * value of the report's "Event Type" column.
 */
public enum LedgerEventType {
    SHIPMENTS("Shipments"),
    WHSE_TRANSFERS("WhseTransfers"),
    ADJUSTMENTS("Adjustments"),
    RECEIPTS("Receipts"),
    CUSTOMER_RETURNS("CustomerReturns"),
    VENDOR_RETURNS("VendorReturns");

    private final String reportValue;

    LedgerEventType(String reportValue) {
        this.reportValue = reportValue;
    }

    public String reportValue() {
        return reportValue;
    }

    /** Case-sensitive match on the report value; empty for types this service does not know. */
    public static Optional<LedgerEventType> fromReportValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        return Arrays.stream(values()).filter(t -> t.reportValue.equals(trimmed)).findFirst();
    }
}
