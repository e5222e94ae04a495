package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.ReimbursedItem;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Read-only inputs for one analysis run. Passes filter these lists themselves, so the loader may over-fetch.
 *
 * @param adjustments              Adjustments ledger events with a loss or damage reason code
 * @param customerReturnLedgerEvents CustomerReturns ledger events (warehouse receipt of returned units)
 * @param reimbursedItems          reimbursements already paid
 * @param customerReturns          customer returns returned to inventory or customer-damaged
 * @param existingClaims           claims already in the queue, any status
 * @param unitPrices               latest yourPrice per fnsku from the unsuppressed inventory snapshot
 */
public record ClaimAnalysisSnapshot(
        List<LedgerEvent> adjustments,
        List<LedgerEvent> customerReturnLedgerEvents,
        List<ReimbursedItem> reimbursedItems,
        List<CustomerReturn> customerReturns,
        List<ClaimableItem> existingClaims,
        Map<String, BigDecimal> unitPrices
) {

    public static ClaimAnalysisSnapshot empty() {
        return new ClaimAnalysisSnapshot(List.of(), List.of(), List.of(), List.of(), List.of(), Map.of());
    }
}
