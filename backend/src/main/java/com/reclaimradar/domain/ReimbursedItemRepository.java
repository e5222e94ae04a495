package com.reclaimradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for reimbursed_items. Upsert by reimbursementId.
 */
public interface ReimbursedItemRepository extends MongoRepository<ReimbursedItem, String> {

    Optional<ReimbursedItem> findByReimbursementId(String reimbursementId);
}
