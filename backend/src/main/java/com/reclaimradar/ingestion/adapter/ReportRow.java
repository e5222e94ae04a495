package com.reclaimradar.ingestion.adapter;

import java.util.Collections;
import java.util.Map;

/**
 * One data line of a report. Values are looked up by header name; {@link #first(String...)} tries aliases in order.
 * A malformed row keeps its line number but has no values.
 */
public final class ReportRow {

    private final int lineNumber;
    private final Map<String, String> values;
    private final String malformedReason;

    private ReportRow(int lineNumber, Map<String, String> values, String malformedReason) {
        this.lineNumber = lineNumber;
        this.values = values;
        this.malformedReason = malformedReason;
    }

    public static ReportRow of(int lineNumber, Map<String, String> values) {
        return new ReportRow(lineNumber, Collections.unmodifiableMap(values), null);
    }

    public static ReportRow malformed(int lineNumber, String reason) {
        return new ReportRow(lineNumber, Map.of(), reason);
    }

    public int lineNumber() {
        return lineNumber;
    }

    public boolean isMalformed() {
        return malformedReason != null;
    }

    public String malformedReason() {
        return malformedReason;
    }

    /**
     * First non-blank value among the given header aliases, trimmed; null when none present.
     */
    public String first(String... aliases) {
        for (String alias : aliases) {
            String v = values.get(alias);
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    public Map<String, String> values() {
        return values;
    }

    @Override
    public String toString() {
        return isMalformed() ? "line " + lineNumber + " (malformed: " + malformedReason + ")" : "line " + lineNumber + " " + values;
    }
}
