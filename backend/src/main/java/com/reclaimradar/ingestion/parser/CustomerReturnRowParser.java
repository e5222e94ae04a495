package com.reclaimradar.ingestion.parser;

import com.reclaimradar.ingestion.adapter.ReportRow;

/**
 * Maps GET_FBA_FULFILLMENT_CUSTOMER_RETURNS_DATA rows. Quantity defaults to 1 when absent or zero.
 */
public final class CustomerReturnRowParser {

    private CustomerReturnRowParser() {
    }

    public static CustomerReturnRow parse(ReportRow row) {
        if (row.isMalformed()) {
            throw new RowParseException(row.lineNumber(), row.malformedReason());
        }
        String orderId = ReportValues.required(row, "orderId", "order-id", "orderId", "Order ID");
        String sku = ReportValues.required(row, "sku", "sku", "SKU");
        String asin = ReportValues.required(row, "asin", "asin", "ASIN");
        String fnsku = ReportValues.required(row, "fnsku", "fnsku", "FNSKU");
        int quantity = ReportValues.intValue(row, 1, "quantity", "quantity");

        return new CustomerReturnRow(
                row.lineNumber(),
                orderId,
                fnsku,
                asin,
                sku,
                ReportValues.orDefault(row, "", "product-name", "productName"),
                ReportValues.requiredInstant(row, "returnDate", "return-date", "returnDate", "Return Date"),
                quantity != 0 ? quantity : 1,
                ReportValues.optional(row, "fulfillment-center-id", "fulfillmentCenterId"),
                ReportValues.optional(row, "detailed-disposition", "detailedDisposition"),
                ReportValues.optional(row, "reason"),
                ReportValues.optional(row, "status"),
                ReportValues.optional(row, "license-plate-number", "licensePlateNumber"),
                ReportValues.optional(row, "customer-comments", "customerComments"));
    }
}
