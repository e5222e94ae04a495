package com.reclaimradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reclaimradar.common.RetryPolicy;
import com.reclaimradar.common.Sleeper;
import com.reclaimradar.ingestion.adapter.ReportProvider;
import com.reclaimradar.ingestion.adapter.spapi.LwaAccessTokenProvider;
import com.reclaimradar.ingestion.adapter.spapi.SpApiClient;
import com.reclaimradar.ingestion.adapter.spapi.SpApiReportProvider;
import com.reclaimradar.ingestion.adapter.spapi.WebClientSpApiClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the SP-API report provider, its rate limiter, and the sync retry policy from reclaimradar.* properties.
 */
@Configuration
@EnableConfigurationProperties({ ProviderProperties.class, ReportPollProperties.class, SyncProperties.class, LedgerProperties.class })
public class IngestionConfig {

    @Bean(name = "reportProviderRateLimiter")
    public RateLimiter reportProviderRateLimiter(ProviderProperties providerProperties) {
        int rps = Math.max(1, providerProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, providerProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("sp-api", config);
    }

    @Bean
    public SpApiClient spApiClient(WebClient.Builder webClientBuilder, ProviderProperties providerProperties) {
        return new WebClientSpApiClient(webClientBuilder, Duration.ofMillis(Math.max(1L, providerProperties.getRequestTimeoutMs())));
    }

    @Bean
    public LwaAccessTokenProvider lwaAccessTokenProvider(SpApiClient spApiClient, ProviderProperties providerProperties,
                                                         ObjectMapper objectMapper) {
        return new LwaAccessTokenProvider(spApiClient, providerProperties, objectMapper);
    }

    @Bean
    public ReportProvider reportProvider(SpApiClient spApiClient, LwaAccessTokenProvider lwaAccessTokenProvider,
                                         ProviderProperties providerProperties,
                                         @Qualifier("reportProviderRateLimiter") RateLimiter rateLimiter,
                                         ObjectMapper objectMapper) {
        return new SpApiReportProvider(spApiClient, lwaAccessTokenProvider, providerProperties, rateLimiter, objectMapper);
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    /** Per-step retry for TRANSIENT / RATE_LIMITED provider failures. */
    @Bean(name = "syncRetryPolicy")
    public RetryPolicy syncRetryPolicy(SyncProperties syncProperties) {
        return new RetryPolicy(
                syncProperties.getRetryBaseDelayMs(),
                syncProperties.getRetryJitterFactor(),
                Math.max(1, syncProperties.getRetryMaxAttempts()));
    }
}
