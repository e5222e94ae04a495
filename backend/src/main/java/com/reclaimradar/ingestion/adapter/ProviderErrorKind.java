package com.reclaimradar.ingestion.adapter;

/**
 * Finite classification of provider failures, decided from HTTP status or transport error.
 */
public enum ProviderErrorKind {
    /** 401/403: credentials rejected. */
    AUTH,
    /** 429 or local rate-limiter timeout. */
    RATE_LIMITED,
    /** 5xx or connection failure. */
    TRANSIENT,
    /** 404: unknown report or document. */
    NOT_FOUND,
    /** Any other client error or unreadable response. */
    FATAL;

    public boolean isRetryable() {
        return this == TRANSIENT || this == RATE_LIMITED;
    }

    public static ProviderErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return AUTH;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 404) {
            return NOT_FOUND;
        }
        if (status >= 500) {
            return TRANSIENT;
        }
        return FATAL;
    }
}
