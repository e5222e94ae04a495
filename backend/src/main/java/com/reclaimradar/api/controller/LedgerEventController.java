package com.reclaimradar.api.controller;

import com.reclaimradar.api.dto.ClaimTextResponse;
import com.reclaimradar.api.dto.LedgerEventResponse;
import com.reclaimradar.api.dto.StatusUpdateRequest;
import com.reclaimradar.claims.lifecycle.LedgerEventStatusService;
import com.reclaimradar.claims.query.ClaimTextGenerator;
import com.reclaimradar.domain.LedgerEvent;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator status override and claim text for inventory ledger events.
 */
@RestController
@RequestMapping("/api/v1/inventory-ledger")
@RequiredArgsConstructor
public class LedgerEventController {

    private final LedgerEventStatusService ledgerEventStatusService;

    @PatchMapping("/{id}/status")
    public ResponseEntity<LedgerEventResponse> updateStatus(@PathVariable String id, @Valid @RequestBody StatusUpdateRequest request) {
        LedgerEvent updated = ledgerEventStatusService.updateStatus(id, request.status(), request.notes());
        return ResponseEntity.ok(LedgerEventResponse.from(updated));
    }

    @GetMapping("/{id}/claim-text")
    public ResponseEntity<ClaimTextResponse> claimText(@PathVariable String id) {
        LedgerEvent event = ledgerEventStatusService.getEvent(id);
        return ResponseEntity.ok(new ClaimTextResponse(id, ClaimTextGenerator.forLedgerEvent(event)));
    }
}
