package com.reclaimradar.config;

import com.reclaimradar.domain.LedgerEvent;
import com.reclaimradar.domain.LedgerEventRepository;
import com.reclaimradar.domain.LedgerEventStatus;
import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.domain.UnsuppressedInventoryRepository;
import com.reclaimradar.ingestion.adapter.ReportTableParser;
import com.reclaimradar.ingestion.job.LedgerStatusRefreshJob;
import com.reclaimradar.ingestion.store.IngestResult;
import com.reclaimradar.ingestion.store.LedgerEventIngestor;
import com.reclaimradar.ingestion.store.UnsuppressedInventoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Testcontainers
class LedgerMongoIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    LedgerEventIngestor ingestor;
    @Autowired
    LedgerEventRepository ledgerEventRepository;
    @Autowired
    LedgerStatusRefreshJob refreshJob;
    @Autowired
    UnsuppressedInventoryStore inventoryStore;
    @Autowired
    UnsuppressedInventoryRepository inventoryRepository;

    @BeforeEach
    void clean() {
        ledgerEventRepository.deleteAll();
        inventoryRepository.deleteAll();
    }

    @Test
    @DisplayName("natural-key index rejects a second event with the same key, absent reference id included")
    void naturalKeyIndex_isUnique() {
        Instant date = Instant.parse("2024-03-01T00:00:00Z");
        ledgerEventRepository.save(event(date));

        assertThatThrownBy(() -> ledgerEventRepository.save(event(date))).isInstanceOf(DuplicateKeyException.class);
        assertThat(ledgerEventRepository
                .findFirstByFnskuAndAsinAndEventDateAndEventTypeAndReferenceIdAndFulfillmentCenter(
                        "X1", "B1", date, LedgerEventType.ADJUSTMENTS, null, "PHX7")).isPresent();
    }

    @Test
    @DisplayName("re-ingesting the same ledger report is idempotent against a real store")
    void reingest_isIdempotent() {
        Instant now = Instant.parse("2024-03-20T12:00:00Z");
        String report = "date\tfnsku\tasin\tsku\tevent-type\tquantity\tfulfillment-center\treason\tunreconciled-quantity\n"
                + "2024-03-10T00:00:00Z\tX1\tB1\tS1\tAdjustments\t-5\tPHX7\tM\t5\n"
                + "2024-03-11T00:00:00Z\tX2\tB2\tS2\tShipments\t-1\t\t\t1\n";

        IngestResult first = ingestor.ingest(ReportTableParser.parse(report), now);
        IngestResult second = ingestor.ingest(ReportTableParser.parse(report), now);

        assertThat(first.created()).isEqualTo(2);
        assertThat(second.created()).isZero();
        assertThat(second.updated()).isZero();
        assertThat(ledgerEventRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("refresher promotes aged WAITING events and resolves reconciled CLAIMABLE ones, leaving operator statuses alone")
    void refresher_movesStatusesForward() {
        Instant now = Instant.parse("2024-03-20T12:00:00Z");
        LedgerEvent aged = event(now.minus(8, ChronoUnit.DAYS));
        aged.setStatus(LedgerEventStatus.WAITING);
        LedgerEvent fresh = event(now.minus(2, ChronoUnit.DAYS));
        fresh.setStatus(LedgerEventStatus.WAITING);
        LedgerEvent reconciled = event(now.minus(30, ChronoUnit.DAYS));
        reconciled.setStatus(LedgerEventStatus.CLAIMABLE);
        reconciled.setUnreconciledQuantity(0);
        LedgerEvent claimed = event(now.minus(30, ChronoUnit.DAYS));
        claimed.setReferenceId("case");
        claimed.setStatus(LedgerEventStatus.CLAIMED);
        claimed.setUnreconciledQuantity(0);
        ledgerEventRepository.save(aged);
        ledgerEventRepository.save(fresh);
        ledgerEventRepository.save(reconciled);
        ledgerEventRepository.save(claimed);

        LedgerStatusRefreshJob.RefreshResult result = refreshJob.refresh(now);
        LedgerStatusRefreshJob.RefreshResult again = refreshJob.refresh(now);

        assertThat(result.promotedToClaimable()).isEqualTo(1);
        assertThat(result.resolved()).isEqualTo(1);
        assertThat(again.promotedToClaimable()).isZero();
        assertThat(again.resolved()).isZero();
        assertThat(ledgerEventRepository.findById(aged.getId()).orElseThrow().getStatus()).isEqualTo(LedgerEventStatus.CLAIMABLE);
        assertThat(ledgerEventRepository.findById(fresh.getId()).orElseThrow().getStatus()).isEqualTo(LedgerEventStatus.WAITING);
        assertThat(ledgerEventRepository.findById(reconciled.getId()).orElseThrow().getStatus()).isEqualTo(LedgerEventStatus.RESOLVED);
        assertThat(ledgerEventRepository.findById(claimed.getId()).orElseThrow().getStatus()).isEqualTo(LedgerEventStatus.CLAIMED);
    }

    @Test
    @DisplayName("inventory snapshot is fully replaced on each sync")
    void snapshotReplace_isTotal() {
        inventoryStore.replaceSnapshot(ReportTableParser.parse(
                "sku\tfnsku\tasin\tyour-price\nS1\tX1\tB1\t10.00\nS2\tX2\tB2\t5.00\n"));

        inventoryStore.replaceSnapshot(ReportTableParser.parse("sku\tfnsku\tasin\tyour-price\nS3\tX3\tB3\t7.25\n"));

        assertThat(inventoryRepository.findAll()).singleElement().satisfies(r -> {
            assertThat(r.getFnsku()).isEqualTo("X3");
            assertThat(r.getYourPrice()).isEqualByComparingTo(new BigDecimal("7.25"));
        });
    }

    private static LedgerEvent event(Instant date) {
        LedgerEvent e = new LedgerEvent();
        e.setFnsku("X1");
        e.setAsin("B1");
        e.setSku("S1");
        e.setEventDate(date);
        e.setEventType(LedgerEventType.ADJUSTMENTS);
        e.setFulfillmentCenter("PHX7");
        e.setQuantity(-3);
        e.setUnreconciledQuantity(3);
        e.setReason("M");
        e.setStatus(LedgerEventStatus.WAITING);
        e.setUpdatedAt(date);
        return e;
    }
}
