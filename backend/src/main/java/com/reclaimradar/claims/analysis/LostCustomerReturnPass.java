package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Returns the customer sent back that never re-entered inventory: status "Unit returned to inventory" with no
 * CustomerReturns ledger event for the fnsku on or after the return date. Skipped when a reimbursement names the
 * same fnsku and order; at most one claim of this category per fnsku.
 */
@Component
@Order(4)
public class LostCustomerReturnPass implements ClaimDetectionPass {

    static final String REASON = "Customer return not received by Amazon warehouse";

    @Override
    public String name() {
        return "lost-customer-return";
    }

    @Override
    public List<ClaimableItem> detect(ClaimAnalysisSnapshot snapshot, Instant now) {
        List<ClaimableItem> seen = new ArrayList<>(snapshot.existingClaims());
        List<ClaimableItem> created = new ArrayList<>();
        for (CustomerReturn r : snapshot.customerReturns()) {
            if (!CustomerReturn.STATUS_RETURNED_TO_INVENTORY.equals(r.getStatus())) {
                continue;
            }
            if (receivedInLedger(snapshot.customerReturnLedgerEvents(), r)) {
                continue;
            }
            if (CustomerReturnReimbursements.isReimbursed(snapshot.reimbursedItems(), r)) {
                continue;
            }
            if (NewClaims.claimedEver(seen, r.getFnsku(), ClaimCategory.CUSTOMER_RETURN_NOT_RECEIVED)) {
                continue;
            }
            ClaimableItem item = NewClaims.fromCustomerReturn(r, ClaimCategory.CUSTOMER_RETURN_NOT_RECEIVED, REASON,
                    snapshot.unitPrices(), now);
            created.add(item);
            seen.add(item);
        }
        return created;
    }

    private static boolean receivedInLedger(List<LedgerEvent> ledgerReturns, CustomerReturn r) {
        return ledgerReturns.stream().anyMatch(e -> e.getEventType() == LedgerEventType.CUSTOMER_RETURNS
                && Objects.equals(e.getFnsku(), r.getFnsku())
                && e.getEventDate() != null
                && r.getReturnDate() != null
                && !e.getEventDate().isBefore(r.getReturnDate()));
    }
}
