package com.reclaimradar.ingestion.adapter;

/**
 * Processing status of a requested report, as returned by the provider.
 */
public enum ReportProcessingStatus {
    IN_QUEUE,
    IN_PROGRESS,
    DONE,
    FATAL,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FATAL || this == CANCELLED;
    }
}
