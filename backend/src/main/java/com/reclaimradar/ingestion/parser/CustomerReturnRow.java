package com.reclaimradar.ingestion.parser;

import java.time.Instant;

/**
 * One mapped line of the FBA customer returns report.
 */
public record CustomerReturnRow(
        int lineNumber,
        String orderId,
        String fnsku,
        String asin,
        String sku,
        String productName,
        Instant returnDate,
        int quantity,
        String fulfillmentCenterId,
        String detailedDisposition,
        String reason,
        String status,
        String licensePlateNumber,
        String customerComments
) {
}
