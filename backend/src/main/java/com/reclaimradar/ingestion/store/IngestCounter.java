package com.reclaimradar.ingestion.store;

/**
 * Mutable tally used while walking a report; frozen into an {@link IngestResult}.
 */
final class IngestCounter {

    private int processed;
    private int created;
    private int updated;
    private int skipped;

    void processed() {
        processed++;
    }

    void created() {
        created++;
    }

    void updated() {
        updated++;
    }

    void skipped() {
        skipped++;
    }

    IngestResult toResult() {
        return new IngestResult(processed, created, updated, skipped);
    }
}
