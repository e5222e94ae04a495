package com.reclaimradar.ingestion.parser;

import java.math.BigDecimal;

/**
 * One mapped line of the unsuppressed inventory report. Absent quantities are null.
 */
public record UnsuppressedInventoryRow(
        int lineNumber,
        String sku,
        String fnsku,
        String asin,
        String productName,
        String condition,
        BigDecimal yourPrice,
        String mfnListingExists,
        Integer mfnFulfillableQuantity,
        String afnListingExists,
        Integer afnWarehouseQuantity,
        Integer afnFulfillableQuantity,
        Integer afnUnsellableQuantity,
        Integer afnReservedQuantity,
        Integer afnTotalQuantity,
        BigDecimal perUnitVolume,
        Integer afnInboundWorkingQuantity,
        Integer afnInboundShippedQuantity,
        Integer afnInboundReceivingQuantity,
        Integer afnResearchingQuantity,
        Integer afnReservedFutureSupply,
        Integer afnFutureSupplyBuyable
) {
}
