package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.LedgerEvent;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Text an operator pastes into a Seller Central reimbursement case.
 */
public final class ClaimTextGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final String UNKNOWN_FC = "Unknown";

    private ClaimTextGenerator() {
    }

    public static String forLedgerEvent(LedgerEvent event) {
        return format(event.getFnsku(), event.getAsin(), event.getFulfillmentCenter(), event.getEventDate(),
                event.getUnreconciledQuantity());
    }

    public static String forClaim(ClaimableItem item) {
        return format(item.getFnsku(), item.getAsin(), item.getFulfillmentCenter(), item.getEventDate(),
                item.getQuantity());
    }

    static String format(String fnsku, String asin, String fulfillmentCenter, Instant eventDate, int quantity) {
        String fc = fulfillmentCenter == null || fulfillmentCenter.isBlank() ? UNKNOWN_FC : fulfillmentCenter;
        String day = eventDate != null ? DAY.format(eventDate) : UNKNOWN_FC;
        return "FNSKU " + fnsku + " (ASIN " + asin + ") lost in FC " + fc + " on " + day
                + ". Quantity unreconciled: " + Math.abs(quantity) + ". Please review and reimburse.";
    }
}
