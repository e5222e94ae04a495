package com.reclaimradar.claims.lifecycle;

import lombok.Getter;

/**
 * Thrown by LedgerEventStatusService. API layer maps INVALID_STATUS to 400 and EVENT_NOT_FOUND to 404.
 */
@Getter
public class LedgerEventStatusException extends RuntimeException {

    public static final String INVALID_STATUS = "INVALID_STATUS";
    public static final String EVENT_NOT_FOUND = "EVENT_NOT_FOUND";

    private final String errorCode;

    public LedgerEventStatusException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
