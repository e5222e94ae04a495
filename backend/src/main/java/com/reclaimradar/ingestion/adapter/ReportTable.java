package com.reclaimradar.ingestion.adapter;

import java.util.List;

/**
 * Header-indexed tab-separated report, as downloaded.
 */
public record ReportTable(List<String> headers, List<ReportRow> rows) {

    public static ReportTable empty() {
        return new ReportTable(List.of(), List.of());
    }

    public int size() {
        return rows.size();
    }
}
