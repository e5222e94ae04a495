package com.reclaimradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger event lifecycle: waiting period, refresh cadence and retention of resolved events.
 */
@ConfigurationProperties(prefix = "reclaimradar.ledger")
@NoArgsConstructor
@Getter
@Setter
public class LedgerProperties {

    /** An unreconciled loss younger than this stays WAITING. */
    private int waitingDays = 7;

    /** How often the status refresher runs. Default hourly. */
    private long statusRefreshIntervalMs = 3_600_000;

    /** RESOLVED events not updated for this many days are deleted. */
    private int retentionDays = 90;

    /** How often retention cleanup runs. Default daily. */
    private long cleanupIntervalMs = 86_400_000;
}
