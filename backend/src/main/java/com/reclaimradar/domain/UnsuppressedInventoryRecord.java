package com.reclaimradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Pricing and quantity snapshot from the unsuppressed inventory report. Replaced wholesale on every sync;
 * only {@link #yourPrice} is read, for claim valuation.
 */
@Document(collection = "unsuppressed_inventory")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UnsuppressedInventoryRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String sku;
    @Indexed
    private String fnsku;
    private String asin;
    private String productName;
    private String condition;
    private BigDecimal yourPrice;
    private String mfnListingExists;
    private Integer mfnFulfillableQuantity;
    private String afnListingExists;
    private Integer afnWarehouseQuantity;
    private Integer afnFulfillableQuantity;
    private Integer afnUnsellableQuantity;
    private Integer afnReservedQuantity;
    private Integer afnTotalQuantity;
    private BigDecimal perUnitVolume;
    private Integer afnInboundWorkingQuantity;
    private Integer afnInboundShippedQuantity;
    private Integer afnInboundReceivingQuantity;
    private Integer afnResearchingQuantity;
    private Integer afnReservedFutureSupply;
    private Integer afnFutureSupplyBuyable;
}
