package com.reclaimradar.ingestion.job;

import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.ingestion.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Retention: deletes RESOLVED ledger events not updated within reclaimradar.ledger.retention-days.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResolvedLedgerEventCleanupJob {

    private final LedgerEventRepository ledgerEventRepository;
    private final LedgerProperties ledgerProperties;

    @Scheduled(
            fixedDelayString = "${reclaimradar.ledger.cleanup-interval-ms:86400000}",
            initialDelayString = "${reclaimradar.ledger.cleanup-interval-ms:86400000}")
    public void runScheduled() {
        cleanup(Instant.now());
    }

    public long cleanup(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(ledgerProperties.getRetentionDays()));
        long deleted = ledgerEventRepository.deleteResolvedUpdatedBefore(cutoff);
        if (deleted > 0) {
            log.info("Deleted {} RESOLVED ledger events last updated before {}", deleted, cutoff);
        }
        return deleted;
    }
}
