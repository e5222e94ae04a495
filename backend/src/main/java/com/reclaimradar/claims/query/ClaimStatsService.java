package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.ClaimableItemRepository;
import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.ReimbursedItem;
import com.reclaimradar.domain.ReimbursedItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link ClaimStats}. Recovered totals group reimbursements by currency; claim totals group by
 * (category, currency).
 */
@Service
@RequiredArgsConstructor
public class ClaimStatsService {

    private static final String DEFAULT_CURRENCY = "USD";

    private final ReimbursedItemRepository reimbursedItemRepository;
    private final ClaimableItemRepository claimableItemRepository;
    private final LedgerEventRepository ledgerEventRepository;

    public ClaimStats getStats() {
        List<ClaimableItem> claims = claimableItemRepository.findAll();
        return new ClaimStats(
                recovered(reimbursedItemRepository.findAll()),
                byCategory(claims),
                byStatus(claims),
                ledgerSummary());
    }

    private static List<ClaimStats.CategoryTotals> recovered(List<ReimbursedItem> items) {
        Map<String, Accumulator> byCurrency = new LinkedHashMap<>();
        for (ReimbursedItem item : items) {
            String currency = item.getCurrencyUnit() != null ? item.getCurrencyUnit() : DEFAULT_CURRENCY;
            byCurrency.computeIfAbsent(currency, k -> new Accumulator())
                    .add(item.getQuantityReimbursedTotal(), item.getAmountTotal());
        }
        List<ClaimStats.CategoryTotals> out = new ArrayList<>();
        byCurrency.forEach((currency, acc) -> out.add(acc.toTotals(ClaimStats.RECOVERED, currency)));
        return out;
    }

    private static List<ClaimStats.CategoryTotals> byCategory(List<ClaimableItem> claims) {
        Map<String, Map<String, Accumulator>> grouped = new LinkedHashMap<>();
        for (ClaimableItem c : claims) {
            String category = c.getCategory() != null ? c.getCategory().name() : "UNKNOWN";
            String currency = c.getCurrency() != null ? c.getCurrency() : DEFAULT_CURRENCY;
            grouped.computeIfAbsent(category, k -> new LinkedHashMap<>())
                    .computeIfAbsent(currency, k -> new Accumulator())
                    .add(c.getQuantity(), c.getEstimatedValue());
        }
        List<ClaimStats.CategoryTotals> out = new ArrayList<>();
        grouped.forEach((category, perCurrency) ->
                perCurrency.forEach((currency, acc) -> out.add(acc.toTotals(category, currency))));
        return out;
    }

    private static Map<String, Long> byStatus(List<ClaimableItem> claims) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ClaimStatus s : ClaimStatus.values()) {
            counts.put(s.name(), 0L);
        }
        for (ClaimableItem c : claims) {
            if (c.getStatus() != null) {
                counts.merge(c.getStatus().name(), 1L, Long::sum);
            }
        }
        return counts;
    }

    private ClaimStats.LedgerSummary ledgerSummary() {
        List<LedgerEvent> claimable = ledgerEventRepository.findByStatus(LedgerEventStatus.CLAIMABLE);
        List<LedgerEvent> waiting = ledgerEventRepository.findByStatus(LedgerEventStatus.WAITING);
        Map<String, Long> counts = new LinkedHashMap<>();
        for (LedgerEventStatus s : LedgerEventStatus.values()) {
            counts.put(s.name(), ledgerEventRepository.countByStatus(s));
        }
        return new ClaimStats.LedgerSummary(
                unreconciledUnits(claimable),
                unreconciledUnits(waiting),
                claimable.size(),
                waiting.size(),
                counts);
    }

    private static long unreconciledUnits(List<LedgerEvent> events) {
        return events.stream().mapToLong(e -> Math.abs(e.getUnreconciledQuantity())).sum();
    }

    private static final class Accumulator {
        private long count;
        private long quantity;
        private BigDecimal value = BigDecimal.ZERO;

        void add(int qty, BigDecimal amount) {
            count++;
            quantity += qty;
            if (amount != null) {
                value = value.add(amount);
            }
        }

        ClaimStats.CategoryTotals toTotals(String category, String currency) {
            return new ClaimStats.CategoryTotals(category, count, quantity, value, currency);
        }
    }
}
