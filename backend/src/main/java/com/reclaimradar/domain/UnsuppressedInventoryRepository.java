package com.reclaimradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the unsuppressed_inventory snapshot.
 */
public interface UnsuppressedInventoryRepository extends MongoRepository<UnsuppressedInventoryRecord, String> {
}
