package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.domain.ReimbursedItem;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Units damaged in the warehouse: Adjustments with reason D or W. Skipped when the fnsku was reimbursed on or
 * after the event date.
 */
@Component
@Order(2)
public class DamagedWarehousePass implements ClaimDetectionPass {

    static final Set<String> REASONS = Set.of("D", "W");

    @Override
    public String name() {
        return "damaged-warehouse";
    }

    @Override
    public List<ClaimableItem> detect(ClaimAnalysisSnapshot snapshot, Instant now) {
        List<ClaimableItem> seen = new ArrayList<>(snapshot.existingClaims());
        List<ClaimableItem> created = new ArrayList<>();
        for (LedgerEvent event : snapshot.adjustments()) {
            if (event.getEventType() != LedgerEventType.ADJUSTMENTS || !REASONS.contains(event.getReason())) {
                continue;
            }
            if (isReimbursedSince(snapshot.reimbursedItems(), event)) {
                continue;
            }
            if (NewClaims.claimedSinceDay(seen, event.getFnsku(), ClaimCategory.DAMAGED_WAREHOUSE, event.getEventDate())) {
                continue;
            }
            int quantity = Math.abs(event.getQuantity());
            ClaimableItem item = NewClaims.fromLedgerEvent(event, ClaimCategory.DAMAGED_WAREHOUSE, quantity,
                    "Damaged in warehouse. Reason: " + event.getReason(), snapshot.unitPrices(), now);
            created.add(item);
            seen.add(item);
        }
        return created;
    }

    private static boolean isReimbursedSince(List<ReimbursedItem> reimbursed, LedgerEvent event) {
        return reimbursed.stream().anyMatch(r -> Objects.equals(r.getFnsku(), event.getFnsku())
                && r.getApprovalDate() != null
                && !r.getApprovalDate().isBefore(event.getEventDate()));
    }
}
