package com.reclaimradar.ingestion.store;

import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.CustomerReturnRepository;
import com.reclaimradar.ingestion.adapter.ReportRow;
import com.reclaimradar.ingestion.adapter.ReportTable;
import com.reclaimradar.ingestion.parser.CustomerReturnRow;
import com.reclaimradar.ingestion.parser.CustomerReturnRowParser;
import com.reclaimradar.ingestion.parser.RowParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Insert-only store for customer returns, keyed by (orderId, fnsku, returnDate). Known returns are left untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CustomerReturnStore {

    private final CustomerReturnRepository repository;

    public IngestResult ingest(ReportTable table) {
        Instant now = Instant.now();
        IngestCounter counter = new IngestCounter();
        for (ReportRow row : table.rows()) {
            counter.processed();
            try {
                CustomerReturnRow parsed = CustomerReturnRowParser.parse(row);
                if (repository.existsByOrderIdAndFnskuAndReturnDate(parsed.orderId(), parsed.fnsku(), parsed.returnDate())) {
                    continue;
                }
                repository.save(toReturn(parsed, now));
                counter.created();
            } catch (RowParseException e) {
                log.warn("Skipping customer return row: {}", e.getMessage());
                counter.skipped();
            } catch (DuplicateKeyException e) {
                log.warn("Skipping customer return row {}: already stored ({})", row.lineNumber(), e.getMessage());
                counter.skipped();
            }
        }
        IngestResult result = counter.toResult();
        log.info("Customer return ingest: processed={} created={} skipped={}",
                result.processed(), result.created(), result.skipped());
        return result;
    }

    private static CustomerReturn toReturn(CustomerReturnRow row, Instant now) {
        CustomerReturn r = new CustomerReturn();
        r.setOrderId(row.orderId());
        r.setFnsku(row.fnsku());
        r.setAsin(row.asin());
        r.setSku(row.sku());
        r.setProductName(row.productName());
        r.setReturnDate(row.returnDate());
        r.setQuantity(row.quantity());
        r.setFulfillmentCenterId(row.fulfillmentCenterId());
        r.setDetailedDisposition(row.detailedDisposition());
        r.setReason(row.reason());
        r.setStatus(row.status());
        r.setLicensePlateNumber(row.licensePlateNumber());
        r.setCustomerComments(row.customerComments());
        r.setCreatedAt(now);
        return r;
    }
}
