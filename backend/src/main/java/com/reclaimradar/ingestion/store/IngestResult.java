package com.reclaimradar.ingestion.store;

/**
 * Row counts for one report ingested into its store. processed counts every row read; skipped counts malformed
 * or rejected rows. Rows dropped by an eligibility rule are processed but neither created nor skipped.
 */
public record IngestResult(int processed, int created, int updated, int skipped) {

    public static IngestResult empty() {
        return new IngestResult(0, 0, 0, 0);
    }
}
