package com.reclaimradar.ingestion.sync;

import com.reclaimradar.domain.SyncLog;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a full reimbursement sync. success is true only when errors is empty.
 * processedCounts holds rows stored per step plus "claimable" (claims created); reportIds holds provider report ids
 * of the steps that got one.
 */
public record SyncResult(
        boolean success,
        SyncLog.SyncLogStatus status,
        Instant dataStartTime,
        Instant dataEndTime,
        List<StepOutcome> perStepStatus,
        Map<String, Integer> processedCounts,
        Map<String, String> reportIds,
        int claimableItemsCreated,
        List<SyncError> errors
) {
}
