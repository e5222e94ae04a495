package com.reclaimradar.claims.query;

import com.reclaimradar.domain.ClaimableItem;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Filtered, sorted, paged reads of claimable items.
 */
@Service
@RequiredArgsConstructor
public class ClaimQueryService {

    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 200;
    static final String DEFAULT_SORT = "createdAt";
    static final Set<String> SORT_FIELDS = Set.of("createdAt", "eventDate", "estimatedValue", "quantity", "fnsku");

    private final MongoTemplate mongoTemplate;

    /**
     * @param page      1-based; values below 1 read the first page
     * @param size      capped at 200
     * @param sortBy    createdAt (default), eventDate, estimatedValue, quantity or fnsku; anything else falls back
     * @param direction ASC or DESC (default)
     */
    public ClaimPage listClaimableItems(ClaimFilter filter, Integer page, Integer size, String sortBy, String direction) {
        int pageSize = Math.max(1, Math.min(size == null ? DEFAULT_PAGE_SIZE : size, MAX_PAGE_SIZE));
        int pageNumber = Math.max(1, page == null ? 1 : page);
        String sortField = sortBy != null && SORT_FIELDS.contains(sortBy) ? sortBy : DEFAULT_SORT;
        Sort.Direction dir = "ASC".equalsIgnoreCase(direction) ? Sort.Direction.ASC : Sort.Direction.DESC;

        Query query = query(filter != null ? filter : ClaimFilter.none());
        long total = mongoTemplate.count(query, ClaimableItem.class);

        query.with(Sort.by(dir, sortField).and(Sort.by(Sort.Direction.ASC, "_id")))
                .skip((long) (pageNumber - 1) * pageSize)
                .limit(pageSize);
        List<ClaimListEntry> items = mongoTemplate.find(query, ClaimableItem.class).stream()
                .map(ClaimListEntry::from)
                .toList();
        int totalPages = (int) ((total + pageSize - 1) / pageSize);
        return new ClaimPage(items, pageNumber, pageSize, total, totalPages);
    }

    private static Query query(ClaimFilter filter) {
        Query query = new Query();
        if (filter.category() != null) {
            query.addCriteria(Criteria.where("category").is(filter.category()));
        }
        if (filter.status() != null) {
            query.addCriteria(Criteria.where("status").is(filter.status()));
        }
        if (filter.fnsku() != null && !filter.fnsku().isBlank()) {
            query.addCriteria(Criteria.where("fnsku").is(filter.fnsku().trim()));
        }
        return query;
    }
}
