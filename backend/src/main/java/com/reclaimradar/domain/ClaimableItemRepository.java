package com.reclaimradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for claimable_items. Filtered/paged reads go through ClaimQueryService (MongoTemplate).
 */
public interface ClaimableItemRepository extends MongoRepository<ClaimableItem, String> {

    List<ClaimableItem> findByCategoryIn(List<ClaimCategory> categories);
}
