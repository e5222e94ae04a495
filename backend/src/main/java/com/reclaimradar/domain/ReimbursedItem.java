package com.reclaimradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A reimbursement the provider already paid out. Ground truth for recovered value; suppresses duplicate claims.
 */
@Document(collection = "reimbursed_items")
@CompoundIndexes({
    @CompoundIndex(name = "fnsku_asin", def = "{'fnsku': 1, 'asin': 1}"),
    @CompoundIndex(name = "fnsku_approvalDate", def = "{'fnsku': 1, 'approvalDate': 1}"),
    @CompoundIndex(name = "fnsku_order", def = "{'fnsku': 1, 'amazonOrderId': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ReimbursedItem {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String reimbursementId;
    private String caseId;
    private String amazonOrderId;
    private String reason;
    private String fnsku;
    private String asin;
    private String sku;
    private String productName;
    private String condition;
    private Instant approvalDate;
    private int quantityReimbursedCash;
    private int quantityReimbursedInventory;
    private int quantityReimbursedTotal;
    private BigDecimal amountPerUnit;
    private BigDecimal amountTotal;
    private String currencyUnit;
    private String originalReimbursementId;
    private String originalReimbursementType;
    private Instant createdAt;
    private Instant updatedAt;
}
