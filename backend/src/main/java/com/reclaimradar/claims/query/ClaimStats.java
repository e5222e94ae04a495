package com.reclaimradar.claims.query;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Dashboard totals: money already recovered, the claim queue by category and status, and ledger event buckets.
 */
public record ClaimStats(
        List<CategoryTotals> recovered,
        List<CategoryTotals> byCategory,
        Map<String, Long> byStatus,
        LedgerSummary ledger
) {

    public static final String RECOVERED = "RECOVERED";

    /** Totals for one (category, currency). totalValue sums known values only. */
    public record CategoryTotals(String category, long itemCount, long totalQuantity, BigDecimal totalValue, String currency) {
    }

    /** Units are absolute unreconciled quantities. */
    public record LedgerSummary(
            long totalClaimableUnits,
            long totalWaitingUnits,
            long claimableEventsCount,
            long waitingEventsCount,
            Map<String, Long> countsByStatus
    ) {
    }
}
