package com.reclaimradar.ingestion.adapter.spapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reclaimradar.ingestion.adapter.ConfigurationException;
import com.reclaimradar.ingestion.adapter.ProviderErrorKind;
import com.reclaimradar.ingestion.adapter.ReportProcessingStatus;
import com.reclaimradar.ingestion.adapter.ReportProvider;
import com.reclaimradar.ingestion.adapter.ReportProviderException;
import com.reclaimradar.ingestion.adapter.ReportStatus;
import com.reclaimradar.ingestion.adapter.ReportType;
import com.reclaimradar.ingestion.config.ProviderProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.zip.GZIPInputStream;

/**
 * {@link ReportProvider} backed by the Selling Partner API Reports 2021-06-30 endpoints.
 * Every call takes a permit from the provider rate limiter; a permit timeout is reported as RATE_LIMITED.
 */
@Slf4j
public class SpApiReportProvider implements ReportProvider {

    private static final String REPORTS_PATH = "/reports/2021-06-30/reports";
    private static final String DOCUMENTS_PATH = "/reports/2021-06-30/documents/";

    private final SpApiClient client;
    private final LwaAccessTokenProvider tokenProvider;
    private final ProviderProperties properties;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SpApiReportProvider(SpApiClient client, LwaAccessTokenProvider tokenProvider, ProviderProperties properties,
                               RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.client = client;
        this.tokenProvider = tokenProvider;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void verifyConfiguration() {
        if (!properties.isComplete()) {
            throw new ConfigurationException(
                    "SP-API credentials incomplete: client id, client secret, refresh token and marketplace id are required");
        }
        try {
            tokenProvider.accessToken();
        } catch (ReportProviderException e) {
            if (e.getKind() == ProviderErrorKind.AUTH || e.getKind() == ProviderErrorKind.FATAL) {
                throw new ConfigurationException("SP-API credentials rejected: " + e.getMessage());
            }
            throw e;
        }
    }

    @Override
    public String createReport(ReportType type, Instant startTime, Instant endTime) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("reportType", type.apiName());
        body.put("marketplaceIds", List.of(properties.getMarketplaceId()));
        body.put("dataStartTime", startTime.toString());
        body.put("dataEndTime", endTime.toString());
        String json = limited("createReport " + type.apiName(),
                () -> client.postJson(properties.getEndpoint() + REPORTS_PATH, tokenProvider.accessToken(), body).block());
        String reportId = readTree(json).path("reportId").asText("");
        log.info("Requested {} report {} for [{}, {})", type.apiName(), reportId, startTime, endTime);
        return reportId;
    }

    @Override
    public ReportStatus getReportStatus(String reportId) {
        String json = limited("getReport " + reportId,
                () -> client.get(properties.getEndpoint() + REPORTS_PATH + "/" + reportId, tokenProvider.accessToken()).block());
        JsonNode root = readTree(json);
        ReportProcessingStatus status = parseStatus(root.path("processingStatus").asText(""));
        String documentId = root.hasNonNull("reportDocumentId") ? root.get("reportDocumentId").asText() : null;
        return new ReportStatus(reportId, status, documentId);
    }

    @Override
    public String downloadReport(String reportDocumentId) {
        String json = limited("getReportDocument " + reportDocumentId,
                () -> client.get(properties.getEndpoint() + DOCUMENTS_PATH + reportDocumentId, tokenProvider.accessToken()).block());
        JsonNode root = readTree(json);
        String url = root.path("url").asText("");
        if (url.isBlank()) {
            throw new ReportProviderException(ProviderErrorKind.FATAL, "Report document " + reportDocumentId + " has no url");
        }
        byte[] content = client.download(url).block();
        boolean gzip = "GZIP".equalsIgnoreCase(root.path("compressionAlgorithm").asText(""));
        return decode(content, gzip);
    }

    private <T> T limited(String operation, Supplier<T> call) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new ReportProviderException(ProviderErrorKind.RATE_LIMITED, "Local limiter timeout before " + operation);
        }
        if (waitedMs >= 1_000L) {
            log.info("Local SP-API limiter delayed {} ms before {}", waitedMs, operation);
        }
        return call.get();
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json == null ? "" : json);
        } catch (IOException e) {
            throw new ReportProviderException(ProviderErrorKind.FATAL, "Unreadable SP-API response", e);
        }
    }

    static ReportProcessingStatus parseStatus(String raw) {
        try {
            return ReportProcessingStatus.valueOf(raw);
        } catch (IllegalArgumentException e) {
            throw new ReportProviderException(ProviderErrorKind.FATAL, "Unknown report processing status: " + raw, e);
        }
    }

    static String decode(byte[] content, boolean gzip) {
        if (content == null) {
            return "";
        }
        if (!gzip) {
            return new String(content, StandardCharsets.UTF_8);
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(content))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportProviderException(ProviderErrorKind.FATAL, "Could not decompress report document", e);
        }
    }
}
