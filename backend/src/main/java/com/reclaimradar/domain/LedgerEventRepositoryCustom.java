package com.reclaimradar.domain;

import java.time.Instant;

/**
 * Bulk status transitions and retention using MongoTemplate.updateMulti / remove.
 */
public interface LedgerEventRepositoryCustom {

    /** WAITING events with eventDate at or before cutoff and unreconciledQuantity &gt; 0 become CLAIMABLE. */
    long promoteWaitingToClaimable(Instant cutoff, Instant now);

    /** CLAIMABLE events whose unreconciledQuantity dropped to 0 become RESOLVED. */
    long resolveReconciledClaimable(Instant now);

    /** Deletes RESOLVED events whose updatedAt is before the cutoff. */
    long deleteResolvedUpdatedBefore(Instant cutoff);
}
