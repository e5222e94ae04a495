package com.reclaimradar.ingestion.adapter;

/**
 * A downloaded and parsed report together with the provider ids it came from.
 */
public record FetchedReport(ReportType reportType, String reportId, String reportDocumentId, ReportTable table) {
}
