package com.reclaimradar.ingestion.store;

import com.reclaimradar.domain.ReimbursedItem;
import com.reclaimradar.domain.ReimbursedItemRepository;
import com.reclaimradar.ingestion.adapter.ReportRow;
import com.reclaimradar.ingestion.adapter.ReportTable;
import com.reclaimradar.ingestion.parser.ReimbursementRow;
import com.reclaimradar.ingestion.parser.ReimbursementRowParser;
import com.reclaimradar.ingestion.parser.RowParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores reimbursement rows keyed by reimbursementId. A known id gets its approval date, quantities and amounts
 * refreshed when any of them differ, and is left alone otherwise; everything else is kept from the first sighting.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReimbursedItemStore {

    private final ReimbursedItemRepository repository;

    public IngestResult ingest(ReportTable table) {
        Instant now = Instant.now();
        IngestCounter counter = new IngestCounter();
        for (ReportRow row : table.rows()) {
            counter.processed();
            try {
                ReimbursementRow parsed = ReimbursementRowParser.parse(row);
                Optional<ReimbursedItem> existing = repository.findByReimbursementId(parsed.reimbursementId());
                if (existing.isPresent()) {
                    ReimbursedItem item = existing.get();
                    if (!hasChanged(item, parsed)) {
                        log.debug("Reimbursement {} unchanged", parsed.reimbursementId());
                        continue;
                    }
                    copyAmountsInto(item, parsed);
                    item.setUpdatedAt(now);
                    repository.save(item);
                    counter.updated();
                } else {
                    repository.save(toItem(parsed, now));
                    counter.created();
                }
            } catch (RowParseException e) {
                log.warn("Skipping reimbursement row: {}", e.getMessage());
                counter.skipped();
            } catch (DuplicateKeyException e) {
                log.warn("Skipping reimbursement row {}: duplicate reimbursement id ({})", row.lineNumber(), e.getMessage());
                counter.skipped();
            }
        }
        IngestResult result = counter.toResult();
        log.info("Reimbursement ingest: processed={} created={} updated={} skipped={}",
                result.processed(), result.created(), result.updated(), result.skipped());
        return result;
    }

    private static ReimbursedItem toItem(ReimbursementRow row, Instant now) {
        ReimbursedItem item = new ReimbursedItem();
        item.setReimbursementId(row.reimbursementId());
        item.setCaseId(row.caseId());
        item.setAmazonOrderId(row.amazonOrderId());
        item.setReason(row.reason());
        item.setFnsku(row.fnsku());
        item.setAsin(row.asin());
        item.setSku(row.sku());
        item.setProductName(row.productName());
        item.setCondition(row.condition());
        item.setCurrencyUnit(row.currencyUnit());
        item.setOriginalReimbursementId(row.originalReimbursementId());
        item.setOriginalReimbursementType(row.originalReimbursementType());
        copyAmountsInto(item, row);
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        return item;
    }

    static boolean hasChanged(ReimbursedItem item, ReimbursementRow row) {
        return !Objects.equals(item.getApprovalDate(), row.approvalDate())
                || item.getQuantityReimbursedCash() != row.quantityReimbursedCash()
                || item.getQuantityReimbursedInventory() != row.quantityReimbursedInventory()
                || item.getQuantityReimbursedTotal() != row.quantityReimbursedTotal()
                || !sameAmount(item.getAmountPerUnit(), row.amountPerUnit())
                || !sameAmount(item.getAmountTotal(), row.amountTotal());
    }

    // compared by value, not scale
    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return a == null ? b == null : b != null && a.compareTo(b) == 0;
    }

    private static void copyAmountsInto(ReimbursedItem target, ReimbursementRow row) {
        target.setApprovalDate(row.approvalDate());
        target.setQuantityReimbursedCash(row.quantityReimbursedCash());
        target.setQuantityReimbursedInventory(row.quantityReimbursedInventory());
        target.setQuantityReimbursedTotal(row.quantityReimbursedTotal());
        target.setAmountPerUnit(row.amountPerUnit());
        target.setAmountTotal(row.amountTotal());
    }
}
