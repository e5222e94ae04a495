package com.reclaimradar.ingestion.adapter;

/**
 * Provider gave up on the report (FATAL or CANCELLED).
 */
public class UpstreamProcessingException extends ReportFetchException {

    public UpstreamProcessingException(ReportType reportType, String reportId, ReportProcessingStatus status) {
        super(PROCESSING_FAILED, reportType, reportId,
                "Report " + reportId + " (" + reportType.apiName() + ") ended with status " + status);
    }
}
