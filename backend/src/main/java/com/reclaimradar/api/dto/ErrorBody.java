package com.reclaimradar.api.dto;

import java.time.Instant;

/**
 * Body of every 4xx from the reimbursement and ledger endpoints. error is a stable code the dashboard switches on
 * (INVALID_STATUS, INVALID_CATEGORY, CLAIM_NOT_FOUND, EVENT_NOT_FOUND, SYNC_IN_PROGRESS, NO_SYNC_RUNNING,
 * INVALID_REQUEST); message is for people.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
