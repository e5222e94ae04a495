package com.reclaimradar.api.dto;

import com.reclaimradar.domain.LedgerEvent;

import java.time.Instant;

public record LedgerEventResponse(
        String id,
        String fnsku,
        String asin,
        String sku,
        String productTitle,
        Instant eventDate,
        String eventType,
        String referenceId,
        int quantity,
        String fulfillmentCenter,
        String reason,
        int reconciledQuantity,
        int unreconciledQuantity,
        String status,
        String statusNote,
        Instant updatedAt
) {

    public static LedgerEventResponse from(LedgerEvent e) {
        return new LedgerEventResponse(
                e.getId(),
                e.getFnsku(),
                e.getAsin(),
                e.getSku(),
                e.getProductTitle(),
                e.getEventDate(),
                e.getEventType() != null ? e.getEventType().reportValue() : null,
                e.getReferenceId(),
                e.getQuantity(),
                e.getFulfillmentCenter(),
                e.getReason(),
                e.getReconciledQuantity(),
                e.getUnreconciledQuantity(),
                e.getStatus() != null ? e.getStatus().name() : null,
                e.getStatusNote(),
                e.getUpdatedAt());
    }
}
