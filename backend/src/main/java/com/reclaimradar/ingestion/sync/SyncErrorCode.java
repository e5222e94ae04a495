package com.reclaimradar.ingestion.sync;

/**
 * Classification of an error recorded in a {@link SyncResult}.
 */
public enum SyncErrorCode {
    /** Provider credentials missing or rejected. */
    CONFIGURATION,
    /** Report never reached DONE. */
    UPSTREAM_TIMEOUT,
    /** Provider reported FATAL or CANCELLED. */
    UPSTREAM_PROCESSING,
    /** Provider call failed, or the provider returned no report / document id. */
    PROVIDER,
    /** Run cancelled before the step. */
    CANCELLED,
    UNEXPECTED
}
