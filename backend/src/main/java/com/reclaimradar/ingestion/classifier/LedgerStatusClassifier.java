package com.reclaimradar.ingestion.classifier;

import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.ingestion.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Computes the automatic status of a ledger event. Rules apply in order:
 * <ol>
 *   <li>WhseTransfers with quantity &gt; 0: RESOLVED</li>
 *   <li>Receipts with quantity &gt; 0: RESOLVED</li>
 *   <li>unreconciledQuantity = 0: RESOLVED</li>
 *   <li>younger than the waiting period: WAITING</li>
 *   <li>otherwise CLAIMABLE</li>
 * </ol>
 * Operator statuses (CLAIM_INITIATED, CLAIMED, PAID, INVALID) are never produced here.
 */
@Component
@RequiredArgsConstructor
public class LedgerStatusClassifier {

    private final LedgerProperties ledgerProperties;

    public LedgerEventStatus classify(LedgerEventType eventType, int quantity, int unreconciledQuantity,
                                      Instant eventDate, Instant now) {
        return classify(eventType, quantity, unreconciledQuantity, eventDate, now,
                Duration.ofDays(ledgerProperties.getWaitingDays()));
    }

    static LedgerEventStatus classify(LedgerEventType eventType, int quantity, int unreconciledQuantity,
                                      Instant eventDate, Instant now, Duration waitingPeriod) {
        if (eventType == LedgerEventType.WHSE_TRANSFERS && quantity > 0) {
            return LedgerEventStatus.RESOLVED;
        }
        if (eventType == LedgerEventType.RECEIPTS && quantity > 0) {
            return LedgerEventStatus.RESOLVED;
        }
        if (unreconciledQuantity == 0) {
            return LedgerEventStatus.RESOLVED;
        }
        if (Duration.between(eventDate, now).compareTo(waitingPeriod) < 0) {
            return LedgerEventStatus.WAITING;
        }
        return LedgerEventStatus.CLAIMABLE;
    }
}
