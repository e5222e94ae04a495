package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.CustomerReturn;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Returns that arrived CUSTOMER_DAMAGED without a matching reimbursement (same fnsku and order).
 * At most one claim of this category per fnsku.
 */
@Component
@Order(5)
public class DamagedCustomerReturnPass implements ClaimDetectionPass {

    static final String REASON = "Customer returned item damaged: " + CustomerReturn.DISPOSITION_CUSTOMER_DAMAGED;

    @Override
    public String name() {
        return "damaged-customer-return";
    }

    @Override
    public List<ClaimableItem> detect(ClaimAnalysisSnapshot snapshot, Instant now) {
        List<ClaimableItem> seen = new ArrayList<>(snapshot.existingClaims());
        List<ClaimableItem> created = new ArrayList<>();
        for (CustomerReturn r : snapshot.customerReturns()) {
            if (!CustomerReturn.DISPOSITION_CUSTOMER_DAMAGED.equals(r.getDetailedDisposition())) {
                continue;
            }
            if (CustomerReturnReimbursements.isReimbursed(snapshot.reimbursedItems(), r)) {
                continue;
            }
            if (NewClaims.claimedEver(seen, r.getFnsku(), ClaimCategory.CUSTOMER_RETURN_DAMAGED)) {
                continue;
            }
            ClaimableItem item = NewClaims.fromCustomerReturn(r, ClaimCategory.CUSTOMER_RETURN_DAMAGED, REASON,
                    snapshot.unitPrices(), now);
            created.add(item);
            seen.add(item);
        }
        return created;
    }
}
