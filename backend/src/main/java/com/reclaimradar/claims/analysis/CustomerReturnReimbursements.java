package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.ReimbursedItem;

import java.util.List;
import java.util.Objects;

final class CustomerReturnReimbursements {

    private CustomerReturnReimbursements() {
    }

    /** A reimbursement for the same fnsku whose amazonOrderId is the return's order. */
    static boolean isReimbursed(List<ReimbursedItem> reimbursed, CustomerReturn r) {
        return reimbursed.stream().anyMatch(item -> Objects.equals(item.getFnsku(), r.getFnsku())
                && r.getOrderId() != null
                && r.getOrderId().equals(item.getAmazonOrderId()));
    }
}
