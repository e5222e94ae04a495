package com.reclaimradar.ingestion.sync;

import com.reclaimradar.ingestion.store.IngestResult;

/**
 * Result of one sync step. counts is empty unless the step succeeded; attempts counts provider retries too.
 */
public record StepOutcome(
        String step,
        StepStatus status,
        String reportId,
        IngestResult counts,
        int attempts,
        SyncErrorCode errorCode,
        String error
) {

    static StepOutcome success(SyncStep step, String reportId, IngestResult counts, int attempts) {
        return new StepOutcome(step.name(), StepStatus.SUCCESS, reportId, counts, attempts, null, null);
    }

    static StepOutcome failed(SyncStep step, int attempts, SyncErrorCode code, String error) {
        return new StepOutcome(step.name(), StepStatus.FAILED, null, IngestResult.empty(), attempts, code, error);
    }

    static StepOutcome cancelled(SyncStep step, String error) {
        return new StepOutcome(step.name(), StepStatus.CANCELLED, null, IngestResult.empty(), 0, SyncErrorCode.CANCELLED, error);
    }

    static StepOutcome notRun(SyncStep step) {
        return new StepOutcome(step.name(), StepStatus.NOT_RUN, null, IngestResult.empty(), 0, null, null);
    }
}
