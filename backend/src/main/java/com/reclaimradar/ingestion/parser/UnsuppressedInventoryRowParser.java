package com.reclaimradar.ingestion.parser;

import com.reclaimradar.ingestion.adapter.ReportRow;

/**
 * Maps GET_FBA_MYI_UNSUPPRESSED_INVENTORY_DATA rows. Required: sku, fnsku, asin.
 */
public final class UnsuppressedInventoryRowParser {

    static final String DEFAULT_CONDITION = "New";

    private UnsuppressedInventoryRowParser() {
    }

    public static UnsuppressedInventoryRow parse(ReportRow row) {
        if (row.isMalformed()) {
            throw new RowParseException(row.lineNumber(), row.malformedReason());
        }
        String sku = ReportValues.required(row, "sku", "sku", "SKU");
        String fnsku = ReportValues.required(row, "fnsku", "fnsku", "FNSKU");
        String asin = ReportValues.required(row, "asin", "asin", "ASIN");

        return new UnsuppressedInventoryRow(
                row.lineNumber(),
                sku,
                fnsku,
                asin,
                ReportValues.orDefault(row, "", "product-name", "productName"),
                ReportValues.orDefault(row, DEFAULT_CONDITION, "condition"),
                ReportValues.decimal(row, null, "yourPrice", "your-price", "yourPrice"),
                ReportValues.optional(row, "mfn-listing-exists", "mfnListingExists"),
                ReportValues.optionalInt(row, "mfnFulfillableQuantity", "mfn-fulfillable-quantity", "mfnFulfillableQuantity"),
                ReportValues.optional(row, "afn-listing-exists", "afnListingExists"),
                ReportValues.optionalInt(row, "afnWarehouseQuantity", "afn-warehouse-quantity", "afnWarehouseQuantity"),
                ReportValues.optionalInt(row, "afnFulfillableQuantity", "afn-fulfillable-quantity", "afnFulfillableQuantity"),
                ReportValues.optionalInt(row, "afnUnsellableQuantity", "afn-unsellable-quantity", "afnUnsellableQuantity"),
                ReportValues.optionalInt(row, "afnReservedQuantity", "afn-reserved-quantity", "afnReservedQuantity"),
                ReportValues.optionalInt(row, "afnTotalQuantity", "afn-total-quantity", "afnTotalQuantity"),
                ReportValues.decimal(row, null, "perUnitVolume", "per-unit-volume", "perUnitVolume"),
                ReportValues.optionalInt(row, "afnInboundWorkingQuantity", "afn-inbound-working-quantity", "afnInboundWorkingQuantity"),
                ReportValues.optionalInt(row, "afnInboundShippedQuantity", "afn-inbound-shipped-quantity", "afnInboundShippedQuantity"),
                ReportValues.optionalInt(row, "afnInboundReceivingQuantity", "afn-inbound-receiving-quantity", "afnInboundReceivingQuantity"),
                ReportValues.optionalInt(row, "afnResearchingQuantity", "afn-researching-quantity", "afnResearchingQuantity"),
                ReportValues.optionalInt(row, "afnReservedFutureSupply", "afn-reserved-future-supply", "afnReservedFutureSupply"),
                ReportValues.optionalInt(row, "afnFutureSupplyBuyable", "afn-future-supply-buyable", "afnFutureSupplyBuyable"));
    }
}
