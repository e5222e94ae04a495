package com.reclaimradar.ingestion.parser;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One mapped line of the FBA reimbursements report.
 */
public record ReimbursementRow(
        int lineNumber,
        String reimbursementId,
        String caseId,
        String amazonOrderId,
        String reason,
        String fnsku,
        String asin,
        String sku,
        String productName,
        String condition,
        Instant approvalDate,
        int quantityReimbursedCash,
        int quantityReimbursedInventory,
        int quantityReimbursedTotal,
        BigDecimal amountPerUnit,
        BigDecimal amountTotal,
        String currencyUnit,
        String originalReimbursementId,
        String originalReimbursementType
) {
}
