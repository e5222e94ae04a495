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
 * Moves ledger events forward as time passes: WAITING to CLAIMABLE once past the waiting period with units still
 * unreconciled, CLAIMABLE to RESOLVED once fully reconciled. Operator statuses are never touched. Idempotent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerStatusRefreshJob {

    private final LedgerEventRepository ledgerEventRepository;
    private final LedgerProperties ledgerProperties;

    public record RefreshResult(long promotedToClaimable, long resolved) {
    }

    @Scheduled(
            fixedDelayString = "${reclaimradar.ledger.status-refresh-interval-ms:3600000}",
            initialDelayString = "${reclaimradar.ledger.status-refresh-interval-ms:3600000}")
    public void runScheduled() {
        refresh(Instant.now());
    }

    public RefreshResult refresh(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(ledgerProperties.getWaitingDays()));
        long promoted = ledgerEventRepository.promoteWaitingToClaimable(cutoff, now);
        long resolved = ledgerEventRepository.resolveReconciledClaimable(now);
        if (promoted > 0 || resolved > 0) {
            log.info("Ledger status refresh: {} WAITING->CLAIMABLE, {} CLAIMABLE->RESOLVED", promoted, resolved);
        } else {
            log.debug("Ledger status refresh: nothing to move");
        }
        return new RefreshResult(promoted, resolved);
    }
}
