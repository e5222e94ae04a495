package com.reclaimradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Row of the FBA customer returns report. Dedup key (orderId, fnsku, returnDate).
 */
@Document(collection = "customer_returns")
@CompoundIndexes({
    @CompoundIndex(name = "order_fnsku_returnDate", def = "{'orderId': 1, 'fnsku': 1, 'returnDate': 1}", unique = true),
    @CompoundIndex(name = "status", def = "{'status': 1}"),
    @CompoundIndex(name = "detailedDisposition", def = "{'detailedDisposition': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CustomerReturn {

    /** Status the provider reports once the returned unit is back in sellable stock. */
    public static final String STATUS_RETURNED_TO_INVENTORY = "Unit returned to inventory";
    public static final String DISPOSITION_CUSTOMER_DAMAGED = "CUSTOMER_DAMAGED";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String orderId;
    private String fnsku;
    private String asin;
    private String sku;
    private String productName;
    private Instant returnDate;
    private int quantity;
    private String fulfillmentCenterId;
    private String detailedDisposition;
    private String reason;
    private String status;
    private String licensePlateNumber;
    private String customerComments;
    private Instant createdAt;
}
