package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.ClaimableItemRepository;
import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.CustomerReturnRepository;
import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.domain.ReimbursedItemRepository;
import com.reclaimradar.domain.UnsuppressedInventoryRecord;
import com.reclaimradar.domain.UnsuppressedInventoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every {@link ClaimDetectionPass} in order and saves what each one finds. Each pass sees the claims saved by
 * the passes before it. A failing pass is logged and counted as 0; the remaining passes still run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ClaimAnalyzer {

    private static final Set<String> ADJUSTMENT_REASONS = Set.of("M", "5", "D", "W");

    private static final Comparator<UnsuppressedInventoryRecord> PRICE_SOURCE_ORDER =
            Comparator.comparing((UnsuppressedInventoryRecord r) -> !hasFulfillableStock(r))
                    .thenComparing(UnsuppressedInventoryRecord::getSku, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<ClaimDetectionPass> passes;
    private final LedgerEventRepository ledgerEventRepository;
    private final ReimbursedItemRepository reimbursedItemRepository;
    private final CustomerReturnRepository customerReturnRepository;
    private final ClaimableItemRepository claimableItemRepository;
    private final UnsuppressedInventoryRepository unsuppressedInventoryRepository;

    public AnalysisResult analyze() {
        return analyze(Instant.now());
    }

    public AnalysisResult analyze(Instant now) {
        Map<String, Integer> createdByPass = new LinkedHashMap<>();
        Map<String, String> failedPasses = new LinkedHashMap<>();
        int total = 0;
        for (ClaimDetectionPass pass : passes) {
            try {
                List<ClaimableItem> found = pass.detect(loadSnapshot(), now);
                if (!found.isEmpty()) {
                    claimableItemRepository.saveAll(found);
                }
                createdByPass.put(pass.name(), found.size());
                total += found.size();
                log.info("Claim pass {}: {} new claimable items", pass.name(), found.size());
            } catch (RuntimeException e) {
                log.error("Claim pass {} failed: {}", pass.name(), e.getMessage(), e);
                createdByPass.put(pass.name(), 0);
                failedPasses.put(pass.name(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        log.info("Claim analysis complete: {} new claimable items", total);
        return new AnalysisResult(total, createdByPass, failedPasses);
    }

    ClaimAnalysisSnapshot loadSnapshot() {
        List<CustomerReturn> returns = new ArrayList<>(
                customerReturnRepository.findByStatus(CustomerReturn.STATUS_RETURNED_TO_INVENTORY));
        for (CustomerReturn damaged : customerReturnRepository.findByDetailedDisposition(CustomerReturn.DISPOSITION_CUSTOMER_DAMAGED)) {
            if (!returns.contains(damaged)) {
                returns.add(damaged);
            }
        }
        return new ClaimAnalysisSnapshot(
                ledgerEventRepository.findByEventTypeAndReasonIn(LedgerEventType.ADJUSTMENTS, ADJUSTMENT_REASONS),
                ledgerEventRepository.findByEventType(LedgerEventType.CUSTOMER_RETURNS),
                reimbursedItemRepository.findAll(),
                returns,
                claimableItemRepository.findByCategoryIn(Arrays.asList(ClaimCategory.values())),
                unitPrices(unsuppressedInventoryRepository.findAll()));
    }

    /**
     * One price per fnsku. With several priced rows for the same fnsku (one per SKU or condition) the row with
     * fulfillable stock wins, then the lowest sku.
     */
    static Map<String, BigDecimal> unitPrices(List<UnsuppressedInventoryRecord> records) {
        Map<String, UnsuppressedInventoryRecord> chosen = new HashMap<>();
        for (UnsuppressedInventoryRecord record : records) {
            if (record.getFnsku() == null || record.getYourPrice() == null) {
                continue;
            }
            chosen.merge(record.getFnsku(), record, (a, b) -> PRICE_SOURCE_ORDER.compare(a, b) <= 0 ? a : b);
        }
        Map<String, BigDecimal> prices = new HashMap<>();
        chosen.forEach((fnsku, record) -> prices.put(fnsku, record.getYourPrice()));
        return prices;
    }

    private static boolean hasFulfillableStock(UnsuppressedInventoryRecord record) {
        return record.getAfnFulfillableQuantity() != null && record.getAfnFulfillableQuantity() > 0;
    }
}
