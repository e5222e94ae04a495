package com.reclaimradar.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * PATCH .../status request body for claims and ledger events.
 */
public record StatusUpdateRequest(@NotBlank(message = "INVALID_STATUS") String status, String notes) {
}
