package com.reclaimradar.ingestion.store;

import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.ingestion.adapter.ReportRow;
import com.reclaimradar.ingestion.adapter.ReportTable;
import com.reclaimradar.ingestion.classifier.LedgerStatusClassifier;
import com.reclaimradar.ingestion.parser.LedgerEventRow;
import com.reclaimradar.ingestion.parser.LedgerRowParser;
import com.reclaimradar.ingestion.parser.RowParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Ingests inventory ledger rows into ledger_events, deduplicated by natural key
 * (fnsku, asin, eventDate, eventType, referenceId, fulfillmentCenter). Re-ingesting the same report is a no-op.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerEventIngestor {

    private final LedgerEventRepository repository;
    private final LedgerStatusClassifier classifier;

    public IngestResult ingest(ReportTable table) {
        return ingest(table, Instant.now());
    }

    public IngestResult ingest(ReportTable table, Instant now) {
        IngestCounter counter = new IngestCounter();
        for (ReportRow row : table.rows()) {
            counter.processed();
            try {
                LedgerEventRow parsed = LedgerRowParser.parse(row);
                if (!isEligible(parsed.eventType(), parsed.quantity())) {
                    log.debug("Ledger row {} not eligible: {} quantity {}", row.lineNumber(), parsed.rawEventType(), parsed.quantity());
                    continue;
                }
                apply(parsed, now, counter);
            } catch (RowParseException e) {
                log.warn("Skipping ledger row: {}", e.getMessage());
                counter.skipped();
            } catch (DuplicateKeyException e) {
                log.warn("Skipping ledger row {}: duplicate natural key ({})", row.lineNumber(), e.getMessage());
                counter.skipped();
            }
        }
        IngestResult result = counter.toResult();
        log.info("Ledger ingest: processed={} created={} updated={} skipped={}",
                result.processed(), result.created(), result.updated(), result.skipped());
        return result;
    }

    /**
     * Adjustments and Shipments need a negative quantity, Receipts a positive one; WhseTransfers always pass.
     * Other event types are not ingested.
     */
    public static boolean isEligible(LedgerEventType eventType, int quantity) {
        if (eventType == null) {
            return false;
        }
        return switch (eventType) {
            case ADJUSTMENTS, SHIPMENTS -> quantity < 0;
            case RECEIPTS -> quantity > 0;
            case WHSE_TRANSFERS -> true;
            default -> false;
        };
    }

    private void apply(LedgerEventRow row, Instant now, IngestCounter counter) {
        Optional<LedgerEvent> existing = repository
                .findFirstByFnskuAndAsinAndEventDateAndEventTypeAndReferenceIdAndFulfillmentCenter(
                        row.fnsku(), row.asin(), row.eventDate(), row.eventType(),
                        row.referenceId(), row.fulfillmentCenter());
        if (existing.isEmpty()) {
            LedgerEvent event = new LedgerEvent();
            copyRowInto(event, row);
            event.setStatus(classify(row, now));
            event.setCreatedAt(now);
            event.setUpdatedAt(now);
            repository.save(event);
            counter.created();
            return;
        }
        LedgerEvent event = existing.get();
        if (!hasChanged(event, row)) {
            log.debug("Ledger row {} unchanged ({} {})", row.lineNumber(), row.fnsku(), row.eventDate());
            return;
        }
        copyRowInto(event, row);
        if (event.getStatus() == null || !event.getStatus().isOperatorOwned()) {
            event.setStatus(classify(row, now));
        }
        event.setUpdatedAt(now);
        repository.save(event);
        counter.updated();
    }

    private LedgerEventStatus classify(LedgerEventRow row, Instant now) {
        return classifier.classify(row.eventType(), row.quantity(), row.unreconciledQuantity(), row.eventDate(), now);
    }

    static boolean hasChanged(LedgerEvent event, LedgerEventRow row) {
        return event.getQuantity() != row.quantity()
                || event.getReconciledQuantity() != row.reconciledQuantity()
                || event.getUnreconciledQuantity() != row.unreconciledQuantity()
                || !Objects.equals(event.getDisposition(), row.disposition())
                || !Objects.equals(event.getProductTitle(), row.productTitle());
    }

    private static void copyRowInto(LedgerEvent target, LedgerEventRow row) {
        target.setFnsku(row.fnsku());
        target.setAsin(row.asin());
        target.setSku(row.sku());
        target.setProductTitle(row.productTitle());
        target.setEventDate(row.eventDate());
        target.setEventType(row.eventType());
        target.setReferenceId(row.referenceId());
        target.setQuantity(row.quantity());
        target.setFulfillmentCenter(row.fulfillmentCenter());
        target.setDisposition(row.disposition());
        target.setReason(row.reason());
        target.setReconciledQuantity(row.reconciledQuantity());
        target.setUnreconciledQuantity(row.unreconciledQuantity());
        target.setCountry(row.country());
        target.setRawTimestamp(row.rawTimestamp());
    }
}
