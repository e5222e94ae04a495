package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.domain.ReimbursedItem;

import java.time.Instant;

final class ClaimFixtures {

    private ClaimFixtures() {
    }

    static LedgerEvent adjustment(String fnsku, String reason, int quantity, int unreconciled, Instant eventDate) {
        LedgerEvent e = new LedgerEvent();
        e.setFnsku(fnsku);
        e.setAsin("B-" + fnsku);
        e.setSku("SKU-" + fnsku);
        e.setProductTitle("Product " + fnsku);
        e.setEventType(LedgerEventType.ADJUSTMENTS);
        e.setEventDate(eventDate);
        e.setReason(reason);
        e.setQuantity(quantity);
        e.setUnreconciledQuantity(unreconciled);
        e.setFulfillmentCenter("PHX7");
        e.setReferenceId("REF-" + fnsku);
        e.setStatus(LedgerEventStatus.WAITING);
        return e;
    }

    static LedgerEvent ledgerReturn(String fnsku, Instant eventDate) {
        LedgerEvent e = new LedgerEvent();
        e.setFnsku(fnsku);
        e.setAsin("B-" + fnsku);
        e.setEventType(LedgerEventType.CUSTOMER_RETURNS);
        e.setEventDate(eventDate);
        e.setQuantity(1);
        return e;
    }

    static ReimbursedItem reimbursement(String fnsku, String asin, String orderId, Instant approvalDate) {
        ReimbursedItem r = new ReimbursedItem();
        r.setReimbursementId("RB-" + fnsku + "-" + orderId);
        r.setFnsku(fnsku);
        r.setAsin(asin);
        r.setAmazonOrderId(orderId);
        r.setApprovalDate(approvalDate);
        return r;
    }

    static CustomerReturn customerReturn(String orderId, String fnsku, String status, String disposition, Instant returnDate) {
        CustomerReturn r = new CustomerReturn();
        r.setOrderId(orderId);
        r.setFnsku(fnsku);
        r.setAsin("B-" + fnsku);
        r.setSku("SKU-" + fnsku);
        r.setStatus(status);
        r.setDetailedDisposition(disposition);
        r.setReturnDate(returnDate);
        r.setQuantity(1);
        return r;
    }

    static ClaimableItem claim(String fnsku, ClaimCategory category, Instant eventDate) {
        ClaimableItem c = new ClaimableItem();
        c.setFnsku(fnsku);
        c.setCategory(category);
        c.setStatus(ClaimStatus.PENDING);
        c.setEventDate(eventDate);
        return c;
    }
}
