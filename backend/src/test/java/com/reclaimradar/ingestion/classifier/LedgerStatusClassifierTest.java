package com.reclaimradar.ingestion.classifier;

import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.ingestion.config.LedgerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerStatusClassifierTest {

    private static final Instant NOW = Instant.parse("2024-03-20T12:00:00Z");

    private final LedgerStatusClassifier classifier = new LedgerStatusClassifier(new LedgerProperties());

    @Test
    @DisplayName("recent lost adjustment with unreconciled units waits")
    void recentUnreconciledAdjustment_isWaiting() {
        LedgerEventStatus status = classifier.classify(LedgerEventType.ADJUSTMENTS, -5, 5,
                Instant.parse("2024-03-18T00:00:00Z"), NOW);
        assertThat(status).isEqualTo(LedgerEventStatus.WAITING);
    }

    @Test
    @DisplayName("adjustment older than the waiting period becomes claimable")
    void oldUnreconciledAdjustment_isClaimable() {
        LedgerEventStatus status = classifier.classify(LedgerEventType.ADJUSTMENTS, -5, 5,
                Instant.parse("2024-03-10T00:00:00Z"), NOW);
        assertThat(status).isEqualTo(LedgerEventStatus.CLAIMABLE);
    }

    @Test
    @DisplayName("age exactly equal to the waiting period is claimable")
    void boundary_isClaimable() {
        LedgerEventStatus status = classifier.classify(LedgerEventType.SHIPMENTS, -1, 1,
                NOW.minus(Duration.ofDays(7)), NOW);
        assertThat(status).isEqualTo(LedgerEventStatus.CLAIMABLE);
    }

    @Test
    @DisplayName("fully reconciled loss resolves regardless of age")
    void zeroUnreconciled_isResolved() {
        LedgerEventStatus status = classifier.classify(LedgerEventType.ADJUSTMENTS, -3, 0,
                NOW.minus(Duration.ofDays(1)), NOW);
        assertThat(status).isEqualTo(LedgerEventStatus.RESOLVED);
    }

    @Test
    @DisplayName("inbound transfers and receipts resolve even with unreconciled units")
    void inboundMovements_areResolved() {
        Instant recent = NOW.minus(Duration.ofDays(1));
        assertThat(classifier.classify(LedgerEventType.WHSE_TRANSFERS, 4, 4, recent, NOW))
                .isEqualTo(LedgerEventStatus.RESOLVED);
        assertThat(classifier.classify(LedgerEventType.RECEIPTS, 10, 2, recent, NOW))
                .isEqualTo(LedgerEventStatus.RESOLVED);
    }

    @Test
    @DisplayName("outbound transfer with unreconciled units follows the age rule")
    void outboundTransfer_followsAgeRule() {
        assertThat(classifier.classify(LedgerEventType.WHSE_TRANSFERS, -4, 4, NOW.minus(Duration.ofDays(2)), NOW))
                .isEqualTo(LedgerEventStatus.WAITING);
        assertThat(classifier.classify(LedgerEventType.WHSE_TRANSFERS, -4, 4, NOW.minus(Duration.ofDays(30)), NOW))
                .isEqualTo(LedgerEventStatus.CLAIMABLE);
    }

    @Test
    @DisplayName("waiting period comes from configuration")
    void configurableWaitingPeriod() {
        assertThat(LedgerStatusClassifier.classify(LedgerEventType.ADJUSTMENTS, -1, 1,
                NOW.minus(Duration.ofDays(10)), NOW, Duration.ofDays(14)))
                .isEqualTo(LedgerEventStatus.WAITING);
    }
}
