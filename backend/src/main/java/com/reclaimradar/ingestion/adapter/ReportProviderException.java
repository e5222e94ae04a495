package com.reclaimradar.ingestion.adapter;

import lombok.Getter;

/**
 * Thrown when a provider call fails (HTTP error, transport error, malformed response).
 */
@Getter
public class ReportProviderException extends RuntimeException {

    private final ProviderErrorKind kind;

    public ReportProviderException(ProviderErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReportProviderException(ProviderErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
