package com.reclaimradar.claims.lifecycle;

import lombok.Getter;

/**
 * Thrown by ClaimLifecycleService. API layer maps INVALID_STATUS to 400 and CLAIM_NOT_FOUND to 404.
 */
@Getter
public class ClaimLifecycleException extends RuntimeException {

    public static final String INVALID_STATUS = "INVALID_STATUS";
    public static final String CLAIM_NOT_FOUND = "CLAIM_NOT_FOUND";

    private final String errorCode;

    public ClaimLifecycleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
