package com.reclaimradar.ingestion.adapter;

/**
 * Report did not reach DONE within the polling ceiling.
 */
public class UpstreamTimeoutException extends ReportFetchException {

    public UpstreamTimeoutException(ReportType reportType, String reportId, long waitedMs) {
        super(TIMEOUT, reportType, reportId,
                "Report " + reportId + " (" + reportType.apiName() + ") not ready after " + waitedMs + " ms");
    }
}
