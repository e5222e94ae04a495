package com.reclaimradar.ingestion.store;

import com.reclaimradar.domain.UnsuppressedInventoryRecord;
import com.reclaimradar.domain.UnsuppressedInventoryRepository;
import com.reclaimradar.ingestion.adapter.ReportRow;
import com.reclaimradar.ingestion.adapter.ReportTable;
import com.reclaimradar.ingestion.parser.RowParseException;
import com.reclaimradar.ingestion.parser.UnsuppressedInventoryRow;
import com.reclaimradar.ingestion.parser.UnsuppressedInventoryRowParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces the unsuppressed inventory snapshot. Rows are mapped first; the delete and the insert then run in one
 * transaction so readers never see a half-empty snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UnsuppressedInventoryStore {

    private final UnsuppressedInventoryRepository repository;
    private final TransactionTemplate transactionTemplate;

    public IngestResult replaceSnapshot(ReportTable table) {
        IngestCounter counter = new IngestCounter();
        List<UnsuppressedInventoryRecord> records = new ArrayList<>();
        for (ReportRow row : table.rows()) {
            counter.processed();
            try {
                records.add(toRecord(UnsuppressedInventoryRowParser.parse(row)));
                counter.created();
            } catch (RowParseException e) {
                log.warn("Skipping inventory row: {}", e.getMessage());
                counter.skipped();
            }
        }
        transactionTemplate.executeWithoutResult(status -> {
            repository.deleteAll();
            if (!records.isEmpty()) {
                repository.insert(records);
            }
        });
        IngestResult result = counter.toResult();
        log.info("Unsuppressed inventory snapshot replaced: {} records ({} rows skipped)", result.created(), result.skipped());
        return result;
    }

    private static UnsuppressedInventoryRecord toRecord(UnsuppressedInventoryRow row) {
        UnsuppressedInventoryRecord r = new UnsuppressedInventoryRecord();
        r.setSku(row.sku());
        r.setFnsku(row.fnsku());
        r.setAsin(row.asin());
        r.setProductName(row.productName());
        r.setCondition(row.condition());
        r.setYourPrice(row.yourPrice());
        r.setMfnListingExists(row.mfnListingExists());
        r.setMfnFulfillableQuantity(row.mfnFulfillableQuantity());
        r.setAfnListingExists(row.afnListingExists());
        r.setAfnWarehouseQuantity(row.afnWarehouseQuantity());
        r.setAfnFulfillableQuantity(row.afnFulfillableQuantity());
        r.setAfnUnsellableQuantity(row.afnUnsellableQuantity());
        r.setAfnReservedQuantity(row.afnReservedQuantity());
        r.setAfnTotalQuantity(row.afnTotalQuantity());
        r.setPerUnitVolume(row.perUnitVolume());
        r.setAfnInboundWorkingQuantity(row.afnInboundWorkingQuantity());
        r.setAfnInboundShippedQuantity(row.afnInboundShippedQuantity());
        r.setAfnInboundReceivingQuantity(row.afnInboundReceivingQuantity());
        r.setAfnResearchingQuantity(row.afnResearchingQuantity());
        r.setAfnReservedFutureSupply(row.afnReservedFutureSupply());
        r.setAfnFutureSupplyBuyable(row.afnFutureSupplyBuyable());
        return r;
    }
}
