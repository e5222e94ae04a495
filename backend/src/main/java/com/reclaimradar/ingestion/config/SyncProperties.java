package com.reclaimradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reimbursement sync run settings: default window, per-step retry on transient provider errors, schedule.
 */
@ConfigurationProperties(prefix = "reclaimradar.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Default window length when the caller supplies none. */
    private int defaultWindowDays = 90;

    /** Default window ends this many days before now; reimbursement data lags 48-72h. */
    private int defaultEndOffsetDays = 3;

    /** Attempts per step (including the first) for TRANSIENT / RATE_LIMITED provider failures. */
    private int retryMaxAttempts = 3;

    /** Base backoff before the first retry; doubles each attempt. */
    private long retryBaseDelayMs = 5_000;

    /** Jitter factor 0..1. */
    private double retryJitterFactor = 0.2;

    /** Run the full sync on a schedule. Off by default. */
    private boolean scheduleEnabled = false;

    /** Interval for the scheduled sync. Default daily. */
    private long scheduleIntervalMs = 86_400_000;
}
