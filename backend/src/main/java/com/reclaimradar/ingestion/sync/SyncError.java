package com.reclaimradar.ingestion.sync;

/**
 * One recorded failure. step is the step or "analysis", or null for run-level failures.
 */
public record SyncError(SyncErrorCode code, String step, String message) {
}
