package com.reclaimradar.ingestion.adapter;

import java.time.Instant;

/**
 * Boundary to the external report provider. Implementations make one network call per method and do not retry;
 * failures surface as {@link ReportProviderException} with a {@link ProviderErrorKind}.
 */
public interface ReportProvider {

    /**
     * Fails with {@link ConfigurationException} when credentials are missing or invalid. Called once before a sync.
     */
    void verifyConfiguration();

    /**
     * Request generation of a report for [startTime, endTime). Returns the provider's report id (may be blank
     * if the provider misbehaves; callers check).
     */
    String createReport(ReportType type, Instant startTime, Instant endTime);

    ReportStatus getReportStatus(String reportId);

    /**
     * Download the finished report body as tab-separated text.
     */
    String downloadReport(String reportDocumentId);
}
