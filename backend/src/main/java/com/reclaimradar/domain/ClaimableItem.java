package com.reclaimradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Candidate reimbursement claim derived by claim analysis. At most one per (fnsku, category, date window).
 * estimatedValue is null when no unit price is known.
 */
@Document(collection = "claimable_items")
@CompoundIndexes({
    @CompoundIndex(name = "fnsku_category_eventDate", def = "{'fnsku': 1, 'category': 1, 'eventDate': 1}"),
    @CompoundIndex(name = "status_createdAt", def = "{'status': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "category_createdAt", def = "{'category': 1, 'createdAt': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ClaimableItem {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String fnsku;
    private String asin;
    private String sku;
    private String productName;
    private ClaimCategory category;
    private ClaimStatus status;
    private int quantity;
    private BigDecimal estimatedValue;
    private String currency;
    private String fulfillmentCenter;
    private Instant eventDate;
    private String referenceId;
    private String reason;
    private String notes;
    private Instant claimSubmittedDate;
    private Instant reimbursementDate;
    private Instant createdAt;
    private Instant updatedAt;
}
