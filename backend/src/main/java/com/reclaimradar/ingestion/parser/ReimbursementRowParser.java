package com.reclaimradar.ingestion.parser;

import com.reclaimradar.ingestion.adapter.ReportRow;

import java.math.BigDecimal;

/**
 * Maps GET_FBA_REIMBURSEMENTS_DATA rows. Required: reimbursement-id, fnsku, asin, sku, approval-date.
 */
public final class ReimbursementRowParser {

    static final String DEFAULT_CONDITION = "NewItem";
    static final String DEFAULT_CURRENCY = "USD";

    private ReimbursementRowParser() {
    }

    public static ReimbursementRow parse(ReportRow row) {
        if (row.isMalformed()) {
            throw new RowParseException(row.lineNumber(), row.malformedReason());
        }
        String reimbursementId = ReportValues.required(row, "reimbursementId", "reimbursement-id", "reimbursementId");
        String fnsku = ReportValues.required(row, "fnsku", "fnsku", "FNSKU");
        String asin = ReportValues.required(row, "asin", "asin", "ASIN");
        String sku = ReportValues.required(row, "sku", "sku", "SKU");

        return new ReimbursementRow(
                row.lineNumber(),
                reimbursementId,
                ReportValues.optional(row, "case-id", "caseId"),
                ReportValues.optional(row, "amazon-order-id", "amazonOrderId"),
                ReportValues.optional(row, "reason"),
                fnsku,
                asin,
                sku,
                ReportValues.orDefault(row, "", "product-name", "productName"),
                ReportValues.orDefault(row, DEFAULT_CONDITION, "condition"),
                ReportValues.requiredInstant(row, "approvalDate", "approval-date", "approvalDate"),
                ReportValues.intValue(row, 0, "quantityReimbursedCash", "quantity-reimbursed-cash", "quantityReimbursedCash"),
                ReportValues.intValue(row, 0, "quantityReimbursedInventory", "quantity-reimbursed-inventory", "quantityReimbursedInventory"),
                ReportValues.intValue(row, 0, "quantityReimbursedTotal", "quantity-reimbursed-total", "quantityReimbursedTotal"),
                ReportValues.decimal(row, BigDecimal.ZERO.setScale(2), "amountPerUnit", "amount-per-unit", "amountPerUnit"),
                ReportValues.decimal(row, BigDecimal.ZERO.setScale(2), "amountTotal", "amount-total", "amountTotal"),
                ReportValues.orDefault(row, DEFAULT_CURRENCY, "currency-unit", "currencyUnit"),
                ReportValues.optional(row, "original-reimbursement-id", "originalReimbursementId"),
                ReportValues.optional(row, "original-reimbursement-type", "originalReimbursementType"));
    }
}
