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
 * One inventory movement from the ledger detail report.
 * Natural key: (fnsku, asin, eventDate, eventType, referenceId, fulfillmentCenter); a missing referenceId or
 * fulfillmentCenter only matches another missing value.
 */
@Document(collection = "ledger_events")
@CompoundIndexes({
    @CompoundIndex(name = "natural_key", def = "{'fnsku': 1, 'asin': 1, 'eventDate': 1, 'eventType': 1, 'referenceId': 1, 'fulfillmentCenter': 1}", unique = true),
    @CompoundIndex(name = "status_eventDate", def = "{'status': 1, 'eventDate': 1}"),
    @CompoundIndex(name = "eventType_reason", def = "{'eventType': 1, 'reason': 1}"),
    @CompoundIndex(name = "fnsku_eventType_eventDate", def = "{'fnsku': 1, 'eventType': 1, 'eventDate': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String fnsku;
    private String asin;
    private String sku;
    private String productTitle;
    private Instant eventDate;
    private LedgerEventType eventType;
    private String referenceId;
    /** Signed: negative for units leaving inventory. */
    private int quantity;
    private String fulfillmentCenter;
    private String disposition;
    /** Adjustment reason code, e.g. M (misplaced), 5, D, W. */
    private String reason;
    private int reconciledQuantity;
    private int unreconciledQuantity;
    private String country;
    private Instant rawTimestamp;
    private LedgerEventStatus status;
    /** Operator note from the last manual status change. */
    private String statusNote;
    private Instant createdAt;
    private Instant updatedAt;
}
