package com.reclaimradar.ingestion.adapter;

import com.reclaimradar.common.Sleeper;
import com.reclaimradar.ingestion.config.ReportPollProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Requests a report, polls until it is ready and downloads it as a {@link ReportTable}.
 * No retry here; the sync orchestrator decides per step.
 */
@Component
@Slf4j
public class ReportFetcher {

    private final ReportProvider provider;
    private final ReportPollProperties pollProperties;
    private final Sleeper sleeper;

    public ReportFetcher(ReportProvider provider, ReportPollProperties pollProperties, Sleeper sleeper) {
        this.provider = provider;
        this.pollProperties = pollProperties;
        this.sleeper = sleeper;
    }

    public FetchedReport fetch(ReportType type, Instant start, Instant end) {
        String reportId = provider.createReport(type, start, end);
        if (reportId == null || reportId.isBlank()) {
            throw new ReportFetchException(ReportFetchException.NO_REPORT_ID, type, null,
                    "Provider returned no report id for " + type.apiName());
        }
        ReportStatus status = awaitCompletion(type, reportId);
        String documentId = status.reportDocumentId();
        if (documentId == null || documentId.isBlank()) {
            throw new ReportFetchException(ReportFetchException.NO_DOCUMENT_ID, type, reportId,
                    "Report " + reportId + " (" + type.apiName() + ") is DONE but has no document id");
        }
        String body = provider.downloadReport(documentId);
        ReportTable table = ReportTableParser.parse(body);
        log.info("Downloaded {} report {}: {} rows", type.apiName(), reportId, table.size());
        return new FetchedReport(type, reportId, documentId, table);
    }

    private ReportStatus awaitCompletion(ReportType type, String reportId) {
        long interval = Math.max(1L, pollProperties.getPollIntervalMs());
        long timeout = Math.max(0L, pollProperties.getTimeoutMs());
        long waited = 0L;
        while (true) {
            ReportStatus status = provider.getReportStatus(reportId);
            ReportProcessingStatus processing = status.processingStatus();
            if (processing == ReportProcessingStatus.DONE) {
                return status;
            }
            if (processing == ReportProcessingStatus.FATAL || processing == ReportProcessingStatus.CANCELLED) {
                throw new UpstreamProcessingException(type, reportId, processing);
            }
            if (waited >= timeout) {
                throw new UpstreamTimeoutException(type, reportId, waited);
            }
            log.debug("Report {} ({}) is {}; polling again in {} ms", reportId, type.apiName(), processing, interval);
            pause(interval);
            waited += interval;
        }
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while polling report status", e);
        }
    }
}
