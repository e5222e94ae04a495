package com.reclaimradar.ingestion.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Runs the full sync over the default window on a fixed delay. Only registered when
 * reclaimradar.sync.schedule-enabled=true.
 */
@Component
@ConditionalOnProperty(prefix = "reclaimradar.sync", name = "schedule-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledReimbursementSyncJob {

    private final ReimbursementSyncOrchestrator orchestrator;

    @Scheduled(
            fixedDelayString = "${reclaimradar.sync.schedule-interval-ms:86400000}",
            initialDelayString = "${reclaimradar.sync.schedule-interval-ms:86400000}")
    public void runScheduled() {
        ReimbursementSyncOrchestrator.SyncWindow window = orchestrator.defaultWindow(Instant.now());
        try {
            SyncResult result = orchestrator.runSync(window.start(), window.end());
            log.info("Scheduled reimbursement sync: {} ({} claims created)", result.status(), result.claimableItemsCreated());
        } catch (SyncAlreadyRunningException e) {
            log.info("Scheduled reimbursement sync skipped: {}", e.getMessage());
        }
    }
}
