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
 * Units Amazon lost in the warehouse: Adjustments with reason M or 5 and at least one unreconciled unit.
 * Skipped when any reimbursement exists for the same fnsku and asin. Ledger status is not consulted;
 * a WAITING event qualifies as soon as it carries the reason code.
 */
@Component
@Order(1)
public class LostWarehousePass implements ClaimDetectionPass {

    static final Set<String> REASONS = Set.of("M", "5");

    @Override
    public String name() {
        return "lost-warehouse";
    }

    @Override
    public List<ClaimableItem> detect(ClaimAnalysisSnapshot snapshot, Instant now) {
        List<ClaimableItem> seen = new ArrayList<>(snapshot.existingClaims());
        List<ClaimableItem> created = new ArrayList<>();
        for (LedgerEvent event : snapshot.adjustments()) {
            if (event.getEventType() != LedgerEventType.ADJUSTMENTS
                    || !REASONS.contains(event.getReason())
                    || event.getUnreconciledQuantity() < 1) {
                continue;
            }
            if (isReimbursed(snapshot.reimbursedItems(), event)) {
                continue;
            }
            if (NewClaims.claimedSinceDay(seen, event.getFnsku(), ClaimCategory.LOST_WAREHOUSE, event.getEventDate())) {
                continue;
            }
            int quantity = Math.abs(event.getUnreconciledQuantity());
            ClaimableItem item = NewClaims.fromLedgerEvent(event, ClaimCategory.LOST_WAREHOUSE, quantity,
                    "Lost in warehouse. Reason: " + event.getReason(), snapshot.unitPrices(), now);
            created.add(item);
            seen.add(item);
        }
        return created;
    }

    private static boolean isReimbursed(List<ReimbursedItem> reimbursed, LedgerEvent event) {
        return reimbursed.stream().anyMatch(r -> Objects.equals(r.getFnsku(), event.getFnsku())
                && Objects.equals(r.getAsin(), event.getAsin()));
    }
}
