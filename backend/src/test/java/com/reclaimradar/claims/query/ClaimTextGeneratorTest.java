package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.LedgerEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ClaimTextGeneratorTest {

    @Test
    @DisplayName("ledger event text carries fnsku, asin, fc, ISO date and absolute unreconciled quantity")
    void ledgerEventText() {
        LedgerEvent event = new LedgerEvent();
        event.setFnsku("X00ABC");
        event.setAsin("B00XYZ");
        event.setFulfillmentCenter("PHX7");
        event.setEventDate(Instant.parse("2024-03-10T23:30:00Z"));
        event.setUnreconciledQuantity(-5);

        String text = ClaimTextGenerator.forLedgerEvent(event);

        assertThat(text).isEqualTo("FNSKU X00ABC (ASIN B00XYZ) lost in FC PHX7 on 2024-03-10. "
                + "Quantity unreconciled: 5. Please review and reimburse.");
    }

    @Test
    @DisplayName("missing fulfillment center reads Unknown")
    void unknownFulfillmentCenter() {
        ClaimableItem item = new ClaimableItem();
        item.setFnsku("X1");
        item.setAsin("B1");
        item.setEventDate(Instant.parse("2024-01-02T00:00:00Z"));
        item.setQuantity(2);

        assertThat(ClaimTextGenerator.forClaim(item))
                .contains("X1", "B1", "lost in FC Unknown", "2024-01-02", "Quantity unreconciled: 2");
    }

    @Test
    void priorityThresholds() {
        assertThat(ClaimPriority.of(new BigDecimal("500.00"))).isEqualTo(ClaimPriority.HIGH);
        assertThat(ClaimPriority.of(new BigDecimal("499.99"))).isEqualTo(ClaimPriority.MEDIUM);
        assertThat(ClaimPriority.of(new BigDecimal("100"))).isEqualTo(ClaimPriority.MEDIUM);
        assertThat(ClaimPriority.of(new BigDecimal("99.99"))).isEqualTo(ClaimPriority.LOW);
        assertThat(ClaimPriority.of(null)).isEqualTo(ClaimPriority.LOW);
    }
}
