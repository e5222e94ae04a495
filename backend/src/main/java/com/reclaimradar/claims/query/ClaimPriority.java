package com.reclaimradar.claims.query;

import java.math.BigDecimal;

/**
 * Follow-up priority by estimated value: HIGH from 500, MEDIUM from 100, else LOW (unknown value included).
 */
public enum ClaimPriority {
    HIGH,
    MEDIUM,
    LOW;

    private static final BigDecimal HIGH_THRESHOLD = BigDecimal.valueOf(500);
    private static final BigDecimal MEDIUM_THRESHOLD = BigDecimal.valueOf(100);

    public static ClaimPriority of(BigDecimal estimatedValue) {
        if (estimatedValue == null) {
            return LOW;
        }
        if (estimatedValue.compareTo(HIGH_THRESHOLD) >= 0) {
            return HIGH;
        }
        if (estimatedValue.compareTo(MEDIUM_THRESHOLD) >= 0) {
            return MEDIUM;
        }
        return LOW;
    }
}
