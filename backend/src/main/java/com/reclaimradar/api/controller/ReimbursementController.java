package com.reclaimradar.api.controller;

import com.reclaimradar.api.dto.ClaimTextResponse;
import com.reclaimradar.api.dto.ErrorBody;
import com.reclaimradar.api.dto.StatusUpdateRequest;
import com.reclaimradar.api.dto.SyncRequest;
import com.reclaimradar.claims.lifecycle.ClaimLifecycleService;
import com.reclaimradar.claims.query.ClaimFilter;
import com.reclaimradar.claims.query.ClaimListEntry;
import com.reclaimradar.claims.query.ClaimPage;
import com.reclaimradar.claims.query.ClaimQueryService;
import com.reclaimradar.claims.query.ClaimStats;
import com.reclaimradar.claims.query.ClaimStatsService;
import com.reclaimradar.claims.query.ClaimTextGenerator;
import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.ingestion.sync.ReimbursementSyncOrchestrator;
import com.reclaimradar.ingestion.sync.SyncResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

/**
 * Sync trigger, claim queue, claim status updates, stats and claim text under /api/v1/reimbursement.
 */
@RestController
@RequestMapping("/api/v1/reimbursement")
@RequiredArgsConstructor
public class ReimbursementController {

    private final ReimbursementSyncOrchestrator syncOrchestrator;
    private final ClaimQueryService claimQueryService;
    private final ClaimLifecycleService claimLifecycleService;
    private final ClaimStatsService claimStatsService;

    /**
     * Runs the full sync off the event loop (provider calls block). 409 while another run is active.
     */
    @PostMapping("/sync")
    public Mono<ResponseEntity<SyncResult>> sync(@RequestBody(required = false) SyncRequest request) {
        return Mono.fromCallable(() -> {
                    Instant start = request != null ? request.dataStartTime() : null;
                    Instant end = request != null ? request.dataEndTime() : null;
                    if (start == null || end == null) {
                        ReimbursementSyncOrchestrator.SyncWindow window = syncOrchestrator.defaultWindow(Instant.now());
                        start = window.start();
                        end = window.end();
                    }
                    return ResponseEntity.ok(syncOrchestrator.runSync(start, end));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/sync/cancel")
    public ResponseEntity<?> cancelSync() {
        if (!syncOrchestrator.cancelRunningSync()) {
            return ResponseEntity.status(404).body(ErrorBody.of("NO_SYNC_RUNNING", "No reimbursement sync is running"));
        }
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/items")
    public ResponseEntity<?> listItems(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String fnsku,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size,
            @RequestParam(required = false, defaultValue = "createdAt") String sortBy,
            @RequestParam(required = false, defaultValue = "DESC") String direction
    ) {
        Optional<ClaimCategory> categoryFilter = parseCategory(category);
        if (category != null && !category.isBlank() && categoryFilter.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_CATEGORY", "Unknown claim category: " + category));
        }
        Optional<ClaimStatus> statusFilter = status == null || status.isBlank() ? Optional.empty() : ClaimStatus.parse(status);
        if (status != null && !status.isBlank() && statusFilter.isEmpty()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_STATUS", "Unknown claim status: " + status));
        }
        ClaimFilter filter = new ClaimFilter(categoryFilter.orElse(null), statusFilter.orElse(null), fnsku);
        ClaimPage result = claimQueryService.listClaimableItems(filter, page, size, sortBy, direction);
        return ResponseEntity.ok(result);
    }

    @PatchMapping("/items/{id}/status")
    public ResponseEntity<ClaimListEntry> updateStatus(@PathVariable String id, @Valid @RequestBody StatusUpdateRequest request) {
        ClaimableItem updated = claimLifecycleService.updateClaimStatus(id, request.status(), request.notes());
        return ResponseEntity.ok(ClaimListEntry.from(updated));
    }

    @GetMapping("/stats")
    public ResponseEntity<ClaimStats> stats() {
        return ResponseEntity.ok(claimStatsService.getStats());
    }

    @GetMapping("/items/{id}/claim-text")
    public ResponseEntity<ClaimTextResponse> claimText(@PathVariable String id) {
        ClaimableItem item = claimLifecycleService.getClaim(id);
        return ResponseEntity.ok(new ClaimTextResponse(id, ClaimTextGenerator.forClaim(item)));
    }

    private static Optional<ClaimCategory> parseCategory(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(ClaimCategory.values()).filter(c -> c.name().equals(raw.strip())).findFirst();
    }
}
