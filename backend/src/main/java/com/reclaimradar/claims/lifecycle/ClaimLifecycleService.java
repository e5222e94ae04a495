package com.reclaimradar.claims.lifecycle;

import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.ClaimableItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

import static com.reclaimradar.claims.lifecycle.ClaimLifecycleException.CLAIM_NOT_FOUND;
import static com.reclaimradar.claims.lifecycle.ClaimLifecycleException.INVALID_STATUS;

/**
 * Operator workflow on claimable items. Any status may move to any other; CLAIMED stamps claimSubmittedDate and
 * REIMBURSED stamps reimbursementDate, each only the first time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClaimLifecycleService {

    private final ClaimableItemRepository claimableItemRepository;

    public ClaimableItem getClaim(String id) {
        return claimableItemRepository.findById(id)
                .orElseThrow(() -> new ClaimLifecycleException(CLAIM_NOT_FOUND, "Claimable item not found: " + id));
    }

    public ClaimableItem updateClaimStatus(String id, String newStatus, String notes) {
        ClaimStatus status = ClaimStatus.parse(newStatus)
                .orElseThrow(() -> new ClaimLifecycleException(INVALID_STATUS, "Invalid claim status: " + newStatus));
        return updateClaimStatus(id, status, notes, Instant.now());
    }

    public ClaimableItem updateClaimStatus(String id, ClaimStatus status, String notes, Instant now) {
        ClaimableItem item = getClaim(id);
        ClaimStatus previous = item.getStatus();
        item.setStatus(status);
        item.setUpdatedAt(now);
        if (notes != null) {
            item.setNotes(notes);
        }
        if (status == ClaimStatus.CLAIMED && item.getClaimSubmittedDate() == null) {
            item.setClaimSubmittedDate(now);
        }
        if (status == ClaimStatus.REIMBURSED && item.getReimbursementDate() == null) {
            item.setReimbursementDate(now);
        }
        ClaimableItem saved = claimableItemRepository.save(item);
        log.info("Claimable item {} status {} -> {}", id, previous, status);
        return saved;
    }
}
