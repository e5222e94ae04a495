package com.reclaimradar.api.dto;

import java.time.Instant;

/**
 * POST /api/v1/reimbursement/sync request body. Both bounds omitted means the default window.
 */
public record SyncRequest(Instant dataStartTime, Instant dataEndTime) {
}
