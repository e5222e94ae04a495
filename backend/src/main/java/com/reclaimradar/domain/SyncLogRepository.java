package com.reclaimradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Append-only sync_logs.
 */
public interface SyncLogRepository extends MongoRepository<SyncLog, String> {

    Optional<SyncLog> findFirstBySyncTypeOrderByCompletedAtDesc(String syncType);
}
