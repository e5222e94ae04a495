package com.reclaimradar.ingestion.sync;

import com.reclaimradar.claims.analysis.AnalysisResult;
import com.reclaimradar.claims.analysis.ClaimAnalyzer;
import com.reclaimradar.common.RetryPolicy;
import com.reclaimradar.common.Sleeper;
import com.reclaimradar.domain.SyncLog;
import com.reclaimradar.domain.SyncLogRepository;
import com.reclaimradar.ingestion.adapter.ConfigurationException;
import com.reclaimradar.ingestion.adapter.FetchedReport;
import com.reclaimradar.ingestion.adapter.ReportFetchException;
import com.reclaimradar.ingestion.adapter.ReportFetcher;
import com.reclaimradar.ingestion.adapter.ReportProvider;
import com.reclaimradar.ingestion.adapter.ReportProviderException;
import com.reclaimradar.ingestion.adapter.ReportTable;
import com.reclaimradar.ingestion.adapter.UpstreamProcessingException;
import com.reclaimradar.ingestion.adapter.UpstreamTimeoutException;
import com.reclaimradar.ingestion.config.SyncProperties;
import com.reclaimradar.ingestion.store.CustomerReturnStore;
import com.reclaimradar.ingestion.store.IngestResult;
import com.reclaimradar.ingestion.store.LedgerEventIngestor;
import com.reclaimradar.ingestion.store.ReimbursedItemStore;
import com.reclaimradar.ingestion.store.UnsuppressedInventoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Full reimbursement sync: four report steps in order, then claim analysis, then one sync_logs entry.
 * A failing step is recorded and the next one still runs; only a failed provider check (bad credentials, or an
 * unreachable provider after retries) fails the whole run, and it still returns a result and logs the run.
 * TRANSIENT and RATE_LIMITED provider failures are retried per step with exponential backoff.
 * One run at a time.
 */
@Service
@Slf4j
public class ReimbursementSyncOrchestrator {

    static final String ANALYSIS_STEP = "analysis";
    static final String CLAIMABLE_COUNT_KEY = "claimable";

    private final ReportProvider reportProvider;
    private final ReportFetcher reportFetcher;
    private final ReimbursedItemStore reimbursedItemStore;
    private final CustomerReturnStore customerReturnStore;
    private final LedgerEventIngestor ledgerEventIngestor;
    private final UnsuppressedInventoryStore unsuppressedInventoryStore;
    private final ClaimAnalyzer claimAnalyzer;
    private final SyncLogRepository syncLogRepository;
    private final TransactionTemplate transactionTemplate;
    private final SyncProperties syncProperties;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SyncCancellationToken> currentToken = new AtomicReference<>();

    public ReimbursementSyncOrchestrator(ReportProvider reportProvider,
                                         ReportFetcher reportFetcher,
                                         ReimbursedItemStore reimbursedItemStore,
                                         CustomerReturnStore customerReturnStore,
                                         LedgerEventIngestor ledgerEventIngestor,
                                         UnsuppressedInventoryStore unsuppressedInventoryStore,
                                         ClaimAnalyzer claimAnalyzer,
                                         SyncLogRepository syncLogRepository,
                                         TransactionTemplate transactionTemplate,
                                         SyncProperties syncProperties,
                                         @Qualifier("syncRetryPolicy") RetryPolicy retryPolicy,
                                         Sleeper sleeper) {
        this.reportProvider = reportProvider;
        this.reportFetcher = reportFetcher;
        this.reimbursedItemStore = reimbursedItemStore;
        this.customerReturnStore = customerReturnStore;
        this.ledgerEventIngestor = ledgerEventIngestor;
        this.unsuppressedInventoryStore = unsuppressedInventoryStore;
        this.claimAnalyzer = claimAnalyzer;
        this.syncLogRepository = syncLogRepository;
        this.transactionTemplate = transactionTemplate;
        this.syncProperties = syncProperties;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /** Default window: ends defaultEndOffsetDays before now and spans defaultWindowDays. */
    public SyncWindow defaultWindow(Instant now) {
        Instant end = now.minus(Duration.ofDays(syncProperties.getDefaultEndOffsetDays()));
        Instant start = end.minus(Duration.ofDays(syncProperties.getDefaultWindowDays()));
        return new SyncWindow(start, end);
    }

    public SyncResult runSync(Instant start, Instant end) {
        return runSync(start, end, new SyncCancellationToken());
    }

    /**
     * @throws IllegalArgumentException     when start is not before end
     * @throws SyncAlreadyRunningException when another run holds the guard
     */
    public SyncResult runSync(Instant start, Instant end, SyncCancellationToken token) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Sync window start must be before end: [" + start + ", " + end + ")");
        }
        if (!running.compareAndSet(false, true)) {
            throw new SyncAlreadyRunningException();
        }
        currentToken.set(token);
        try {
            return doRun(start, end, token);
        } finally {
            currentToken.set(null);
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Cancels the run in progress, if any. Returns false when nothing is running. */
    public boolean cancelRunningSync() {
        SyncCancellationToken token = currentToken.get();
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("Cancellation requested for running reimbursement sync");
        return true;
    }

    private SyncResult doRun(Instant start, Instant end, SyncCancellationToken token) {
        Instant runStart = Instant.now();
        log.info("Starting reimbursement sync for [{}, {})", start, end);
        List<SyncError> errors = new ArrayList<>();
        List<StepOutcome> outcomes = new ArrayList<>();

        Optional<SyncError> preflight = verifyProvider(token);
        if (preflight.isPresent()) {
            log.error("Reimbursement sync aborted: {}", preflight.get().message());
            errors.add(preflight.get());
            for (SyncStep step : SyncStep.values()) {
                outcomes.add(StepOutcome.notRun(step));
            }
            SyncResult result = buildResult(start, end, outcomes, 0, errors, SyncLog.SyncLogStatus.FAILED);
            appendSyncLog(result, runStart, 0);
            return result;
        }

        for (SyncStep step : SyncStep.values()) {
            if (token.isCancelled()) {
                String message = "Sync cancelled before " + step.label();
                errors.add(new SyncError(SyncErrorCode.CANCELLED, step.name(), message));
                outcomes.add(StepOutcome.cancelled(step, message));
                continue;
            }
            StepOutcome outcome = runStep(step, start, end, token);
            outcomes.add(outcome);
            if (outcome.status() == StepStatus.FAILED) {
                errors.add(new SyncError(outcome.errorCode(), step.name(), outcome.error()));
            }
        }

        int claimsCreated = 0;
        if (token.isCancelled()) {
            errors.add(new SyncError(SyncErrorCode.CANCELLED, ANALYSIS_STEP, "Sync cancelled before claim analysis"));
        } else {
            claimsCreated = runAnalysis(errors);
        }

        SyncLog.SyncLogStatus status = overallStatus(outcomes, errors);
        SyncResult result = buildResult(start, end, outcomes, claimsCreated, errors, status);
        int ledgerUpdated = outcomes.stream()
                .filter(o -> SyncStep.INVENTORY_LEDGER.name().equals(o.step()))
                .mapToInt(o -> o.counts().updated())
                .sum();
        appendSyncLog(result, runStart, ledgerUpdated);
        log.info("Reimbursement sync finished: status={} claimsCreated={} errors={}", status, claimsCreated, errors.size());
        return result;
    }

    /**
     * Credential check before any step. Retryable provider failures get the same backoff as a step; anything
     * else ends the run. Empty when the provider is usable.
     */
    private Optional<SyncError> verifyProvider(SyncCancellationToken token) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                reportProvider.verifyConfiguration();
                return Optional.empty();
            } catch (ConfigurationException e) {
                return Optional.of(new SyncError(SyncErrorCode.CONFIGURATION, null, e.getMessage()));
            } catch (ReportProviderException e) {
                if (e.getKind().isRetryable() && attempt < maxAttempts) {
                    long delay = retryPolicy.delayMs(attempt - 1);
                    log.warn("Provider check attempt {}/{} failed ({}), retrying in {} ms: {}",
                            attempt, maxAttempts, e.getKind(), delay, e.getMessage());
                    if (!pause(delay)) {
                        token.cancel();
                        return Optional.of(new SyncError(SyncErrorCode.CANCELLED, null,
                                "Sync cancelled while checking provider access"));
                    }
                    continue;
                }
                return Optional.of(new SyncError(SyncErrorCode.PROVIDER, null,
                        "Provider check failed after " + attempt + " attempt(s): " + messageOf(e)));
            }
        }
    }

    private StepOutcome runStep(SyncStep step, Instant start, Instant end, SyncCancellationToken token) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                FetchedReport report = reportFetcher.fetch(step.reportType(), start, end);
                IngestResult counts = store(step, report.table());
                log.info("Sync step {} done: report {} stored={} skipped={}",
                        step, report.reportId(), counts.created() + counts.updated(), counts.skipped());
                return StepOutcome.success(step, report.reportId(), counts, attempt);
            } catch (ReportProviderException e) {
                if (e.getKind().isRetryable() && attempt < maxAttempts) {
                    long delay = retryPolicy.delayMs(attempt - 1);
                    log.warn("Sync step {} attempt {}/{} failed ({}), retrying in {} ms: {}",
                            step, attempt, maxAttempts, e.getKind(), delay, e.getMessage());
                    if (!pause(delay)) {
                        // interrupted: later steps would fail on their first poll sleep
                        token.cancel();
                        return failed(step, attempt, SyncErrorCode.CANCELLED, e);
                    }
                    continue;
                }
                return failed(step, attempt, SyncErrorCode.PROVIDER, e);
            } catch (RuntimeException e) {
                return failed(step, attempt, classify(e), e);
            }
        }
    }

    private IngestResult store(SyncStep step, ReportTable table) {
        return switch (step) {
            case REIMBURSEMENTS -> reimbursedItemStore.ingest(table);
            case CUSTOMER_RETURNS -> customerReturnStore.ingest(table);
            case INVENTORY_LEDGER -> ledgerEventIngestor.ingest(table);
            case UNSUPPRESSED_INVENTORY -> unsuppressedInventoryStore.replaceSnapshot(table);
        };
    }

    private StepOutcome failed(SyncStep step, int attempts, SyncErrorCode code, RuntimeException e) {
        String message = "Failed to sync " + step.label() + " report: " + messageOf(e);
        log.warn("{} (after {} attempt(s))", message, attempts);
        return StepOutcome.failed(step, attempts, code, message);
    }

    static SyncErrorCode classify(RuntimeException e) {
        if (e instanceof ConfigurationException) {
            return SyncErrorCode.CONFIGURATION;
        }
        if (e instanceof UpstreamTimeoutException) {
            return SyncErrorCode.UPSTREAM_TIMEOUT;
        }
        if (e instanceof UpstreamProcessingException) {
            return SyncErrorCode.UPSTREAM_PROCESSING;
        }
        if (e instanceof ReportFetchException || e instanceof ReportProviderException) {
            return SyncErrorCode.PROVIDER;
        }
        return SyncErrorCode.UNEXPECTED;
    }

    private int runAnalysis(List<SyncError> errors) {
        try {
            AnalysisResult analysis = claimAnalyzer.analyze();
            analysis.failedPasses().forEach((pass, message) -> errors.add(new SyncError(
                    SyncErrorCode.UNEXPECTED, ANALYSIS_STEP, "Failed to analyze claimable items: " + pass + ": " + message)));
            return analysis.totalCreated();
        } catch (RuntimeException e) {
            log.error("Claim analysis failed: {}", e.getMessage(), e);
            errors.add(new SyncError(SyncErrorCode.UNEXPECTED, ANALYSIS_STEP,
                    "Failed to analyze claimable items: " + messageOf(e)));
            return 0;
        }
    }

    private static SyncLog.SyncLogStatus overallStatus(List<StepOutcome> outcomes, List<SyncError> errors) {
        if (errors.isEmpty()) {
            return SyncLog.SyncLogStatus.SUCCESS;
        }
        boolean noStepSucceeded = outcomes.stream().noneMatch(o -> o.status() == StepStatus.SUCCESS);
        return noStepSucceeded ? SyncLog.SyncLogStatus.FAILED : SyncLog.SyncLogStatus.PARTIAL_SUCCESS;
    }

    private static SyncResult buildResult(Instant start, Instant end, List<StepOutcome> outcomes, int claimsCreated,
                                          List<SyncError> errors, SyncLog.SyncLogStatus status) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> reportIds = new LinkedHashMap<>();
        for (SyncStep step : SyncStep.values()) {
            Optional<StepOutcome> outcome = outcomes.stream().filter(o -> step.name().equals(o.step())).findFirst();
            counts.put(step.countKey(), outcome.map(o -> o.counts().created() + o.counts().updated()).orElse(0));
            outcome.map(StepOutcome::reportId).ifPresent(id -> reportIds.put(step.reportIdKey(), id));
        }
        counts.put(CLAIMABLE_COUNT_KEY, claimsCreated);
        return new SyncResult(errors.isEmpty(), status, start, end, List.copyOf(outcomes), counts, reportIds,
                claimsCreated, List.copyOf(errors));
    }

    private void appendSyncLog(SyncResult result, Instant runStart, int ledgerUpdated) {
        Instant now = Instant.now();
        SyncLog entry = new SyncLog();
        entry.setSyncType(SyncLog.TYPE_REIMBURSEMENT_FULL_SYNC);
        entry.setStartDate(runStart);
        entry.setEndDate(now);
        entry.setDataStartTime(result.dataStartTime());
        entry.setDataEndTime(result.dataEndTime());
        entry.setStatus(result.status());
        entry.setRecordsProcessed(result.processedCounts().entrySet().stream()
                .filter(e -> !CLAIMABLE_COUNT_KEY.equals(e.getKey()))
                .mapToInt(Map.Entry::getValue)
                .sum());
        entry.setRecordsAdded(result.claimableItemsCreated());
        entry.setRecordsUpdated(ledgerUpdated);
        entry.setErrorMessage(result.errors().isEmpty() ? null
                : result.errors().stream().map(SyncError::message).collect(Collectors.joining("; ")));
        entry.setCompletedAt(now);
        try {
            transactionTemplate.executeWithoutResult(status -> syncLogRepository.save(entry));
        } catch (RuntimeException e) {
            log.error("Could not append sync log entry: {}", e.getMessage(), e);
        }
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Half-open report window [start, end). */
    public record SyncWindow(Instant start, Instant end) {
    }
}
