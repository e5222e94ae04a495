package com.reclaimradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for ledger_events. Natural-key lookup backs dedup-before-insert in LedgerEventIngestor.
 */
public interface LedgerEventRepository extends MongoRepository<LedgerEvent, String>, LedgerEventRepositoryCustom {

    /**
     * Natural-key lookup. Null referenceId / fulfillmentCenter match documents where the field is null or absent.
     */
    Optional<LedgerEvent> findFirstByFnskuAndAsinAndEventDateAndEventTypeAndReferenceIdAndFulfillmentCenter(
            String fnsku, String asin, Instant eventDate, LedgerEventType eventType,
            String referenceId, String fulfillmentCenter);

    /** Claim analysis: adjustments with the given reason codes. */
    List<LedgerEvent> findByEventTypeAndReasonIn(LedgerEventType eventType, Collection<String> reasons);

    /** Claim analysis: every event of a type (e.g. CustomerReturns receipts). */
    List<LedgerEvent> findByEventType(LedgerEventType eventType);

    List<LedgerEvent> findByStatus(LedgerEventStatus status);

    long countByStatus(LedgerEventStatus status);
}
