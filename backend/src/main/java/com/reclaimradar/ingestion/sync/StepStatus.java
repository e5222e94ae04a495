package com.reclaimradar.ingestion.sync;

public enum StepStatus {
    SUCCESS,
    FAILED,
    CANCELLED,
    NOT_RUN
}
