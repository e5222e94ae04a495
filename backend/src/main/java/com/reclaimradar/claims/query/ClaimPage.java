package com.reclaimradar.claims.query;

import java.util.List;

/**
 * One page of claimable items. page is 1-based.
 */
public record ClaimPage(List<ClaimListEntry> items, int page, int size, long total, int totalPages) {
}
