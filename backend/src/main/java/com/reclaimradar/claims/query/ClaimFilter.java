package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimStatus;

/**
 * Optional filters for listing claimable items; null means any.
 */
public record ClaimFilter(ClaimCategory category, ClaimStatus status, String fnsku) {

    public static ClaimFilter none() {
        return new ClaimFilter(null, null, null);
    }
}
