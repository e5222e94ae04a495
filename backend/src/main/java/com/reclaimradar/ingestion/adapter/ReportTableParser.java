package com.reclaimradar.ingestion.adapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses tab-separated report text. First line is the header; blank lines are ignored. A line whose field count
 * differs from the header count becomes a malformed row instead of aborting the batch.
 */
public final class ReportTableParser {

    private ReportTableParser() {
    }

    public static ReportTable parse(String text) {
        if (text == null || text.isBlank()) {
            return ReportTable.empty();
        }
        String[] lines = text.split("\r?\n", -1);
        int headerIndex = 0;
        while (headerIndex < lines.length && lines[headerIndex].isBlank()) {
            headerIndex++;
        }
        List<String> headers = new ArrayList<>();
        for (String h : lines[headerIndex].split("\t", -1)) {
            headers.add(stripBom(h).trim());
        }
        List<ReportRow> rows = new ArrayList<>();
        for (int i = headerIndex + 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            String[] fields = line.split("\t", -1);
            if (fields.length != headers.size()) {
                rows.add(ReportRow.malformed(lineNumber,
                        "expected " + headers.size() + " fields, found " + fields.length));
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int f = 0; f < fields.length; f++) {
                values.put(headers.get(f), fields[f]);
            }
            rows.add(ReportRow.of(lineNumber, values));
        }
        return new ReportTable(List.copyOf(headers), List.copyOf(rows));
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
