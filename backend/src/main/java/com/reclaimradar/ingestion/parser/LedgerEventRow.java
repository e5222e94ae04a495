package com.reclaimradar.ingestion.parser;

import com.reclaimradar.domain.LedgerEventType;

import java.time.Instant;

/**
 * One mapped line of the inventory ledger detail report. eventType is null when the raw value is not a known type.
 * Reconciled and unreconciled quantities are non-negative.
 */
public record LedgerEventRow(
        int lineNumber,
        String fnsku,
        String asin,
        String sku,
        String productTitle,
        Instant eventDate,
        String rawEventType,
        LedgerEventType eventType,
        String referenceId,
        int quantity,
        String fulfillmentCenter,
        String disposition,
        String reason,
        String country,
        int reconciledQuantity,
        int unreconciledQuantity,
        Instant rawTimestamp
) {
}
