package com.reclaimradar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of LedgerEventRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class LedgerEventRepositoryImpl implements LedgerEventRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public long promoteWaitingToClaimable(Instant cutoff, Instant now) {
        Query query = new Query(where("status").is(LedgerEventStatus.WAITING)
                .and("eventDate").lte(cutoff)
                .and("unreconciledQuantity").gt(0));
        Update update = new Update().set("status", LedgerEventStatus.CLAIMABLE).set("updatedAt", now);
        return mongoTemplate.updateMulti(query, update, LedgerEvent.class).getModifiedCount();
    }

    @Override
    public long resolveReconciledClaimable(Instant now) {
        Query query = new Query(where("status").is(LedgerEventStatus.CLAIMABLE)
                .and("unreconciledQuantity").is(0));
        Update update = new Update().set("status", LedgerEventStatus.RESOLVED).set("updatedAt", now);
        return mongoTemplate.updateMulti(query, update, LedgerEvent.class).getModifiedCount();
    }

    @Override
    public long deleteResolvedUpdatedBefore(Instant cutoff) {
        Query query = new Query(where("status").is(LedgerEventStatus.RESOLVED).and("updatedAt").lt(cutoff));
        return mongoTemplate.remove(query, LedgerEvent.class).getDeletedCount();
    }
}
