package com.reclaimradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

/**
 * Persistence for customer_returns. Insert-only by (orderId, fnsku, returnDate).
 */
public interface CustomerReturnRepository extends MongoRepository<CustomerReturn, String> {

    boolean existsByOrderIdAndFnskuAndReturnDate(String orderId, String fnsku, Instant returnDate);

    List<CustomerReturn> findByStatus(String status);

    List<CustomerReturn> findByDetailedDisposition(String detailedDisposition);
}
