package com.reclaimradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operator workflow status of a claimable item. No transition graph is enforced.
 */
public enum ClaimStatus {
    PENDING,
    CLAIMABLE,
    CLAIMED,
    REIMBURSED,
    DENIED,
    EXPIRED;

    public static Optional<ClaimStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(s -> s.name().equals(value.strip())).findFirst();
    }
}
