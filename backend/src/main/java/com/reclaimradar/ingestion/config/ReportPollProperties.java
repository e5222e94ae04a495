package com.reclaimradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Report status polling. The fetcher polls at a fixed interval until DONE/FATAL or the ceiling elapses.
 */
@ConfigurationProperties(prefix = "reclaimradar.report")
@NoArgsConstructor
@Getter
@Setter
public class ReportPollProperties {

    /** Fixed delay between status polls. Default 10s. */
    private long pollIntervalMs = 10_000;

    /** Overall ceiling for one report to reach DONE. Default 300s. */
    private long timeoutMs = 300_000;
}
