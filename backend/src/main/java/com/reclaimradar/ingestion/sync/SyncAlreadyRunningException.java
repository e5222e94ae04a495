package com.reclaimradar.ingestion.sync;

/**
 * A second sync was requested while one is in progress. API layer maps to 409 SYNC_IN_PROGRESS.
 */
public class SyncAlreadyRunningException extends RuntimeException {

    public SyncAlreadyRunningException() {
        super("A reimbursement sync is already running");
    }
}
