package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimableItem;

import java.math.BigDecimal;
import java.time.Instant;

public record ClaimListEntry(
        String id,
        String fnsku,
        String asin,
        String sku,
        String productName,
        String category,
        String categoryLabel,
        String status,
        int quantity,
        BigDecimal estimatedValue,
        String currency,
        String fulfillmentCenter,
        Instant eventDate,
        String referenceId,
        String reason,
        String notes,
        Instant claimSubmittedDate,
        Instant reimbursementDate,
        Instant createdAt,
        Instant updatedAt,
        ClaimPriority priority
) {

    public static ClaimListEntry from(ClaimableItem item) {
        return new ClaimListEntry(
                item.getId(),
                item.getFnsku(),
                item.getAsin(),
                item.getSku(),
                item.getProductName(),
                item.getCategory() != null ? item.getCategory().name() : null,
                item.getCategory() != null ? item.getCategory().label() : null,
                item.getStatus() != null ? item.getStatus().name() : null,
                item.getQuantity(),
                item.getEstimatedValue(),
                item.getCurrency(),
                item.getFulfillmentCenter(),
                item.getEventDate(),
                item.getReferenceId(),
                item.getReason(),
                item.getNotes(),
                item.getClaimSubmittedDate(),
                item.getReimbursementDate(),
                item.getCreatedAt(),
                item.getUpdatedAt(),
                ClaimPriority.of(item.getEstimatedValue()));
    }
}
