package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimableItem;

import java.time.Instant;
import java.util.List;

/**
 * One claim-derivation rule. Pure: reads the snapshot and returns new, unsaved claims. Must not return a claim that
 * duplicates one in the snapshot or one it already returned in the same call.
 */
public interface ClaimDetectionPass {

    /** Short name used in logs and analysis results. */
    String name();

    List<ClaimableItem> detect(ClaimAnalysisSnapshot snapshot, Instant now);
}
