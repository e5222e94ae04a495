package com.reclaimradar.ingestion.adapter;

/**
 * Snapshot of a report's processing state. reportDocumentId is set once status is DONE.
 */
public record ReportStatus(String reportId, ReportProcessingStatus processingStatus, String reportDocumentId) {
}
