package com.reclaimradar.api.dto;

public record ClaimTextResponse(String id, String claimText) {
}
