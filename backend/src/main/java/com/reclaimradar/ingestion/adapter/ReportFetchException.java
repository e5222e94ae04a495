package com.reclaimradar.ingestion.adapter;

import lombok.Getter;

/**
 * A report could not be obtained. {@link #getErrorCode()} tells why: no report id, no document id,
 * or (subclasses) polling timeout / provider-side failure.
 */
@Getter
public class ReportFetchException extends RuntimeException {

    public static final String NO_REPORT_ID = "NO_REPORT_ID";
    public static final String NO_DOCUMENT_ID = "NO_DOCUMENT_ID";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String PROCESSING_FAILED = "PROCESSING_FAILED";

    private final String errorCode;
    private final ReportType reportType;
    private final String reportId;

    public ReportFetchException(String errorCode, ReportType reportType, String reportId, String message) {
        super(message);
        this.errorCode = errorCode;
        this.reportType = reportType;
        this.reportId = reportId;
    }
}
