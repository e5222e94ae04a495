package com.reclaimradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Selling Partner API credentials and endpoints. Credentials come from the environment (see application.yml);
 * a sync refuses to start while any of them is blank.
 */
@ConfigurationProperties(prefix = "reclaimradar.provider")
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    private String clientId;
    private String clientSecret;
    private String refreshToken;
    private String marketplaceId;

    /** Regional SP-API endpoint. Default North America. */
    private String endpoint = "https://sellingpartnerapi-na.amazon.com";

    /** Login with Amazon token endpoint. */
    private String tokenEndpoint = "https://api.amazon.com/auth/o2/token";

    /** Local cap on provider calls per second. The Reports API allows bursts of 15 with ~1 rps restore. */
    private int maxRequestsPerSecond = 1;

    /** How long a call may wait for a rate-limiter permit before failing as RATE_LIMITED. */
    private long limiterTimeoutMs = 30_000;

    /** Per-request timeout for provider HTTP calls. */
    private long requestTimeoutMs = 60_000;

    public boolean isComplete() {
        return notBlank(clientId) && notBlank(clientSecret) && notBlank(refreshToken) && notBlank(marketplaceId);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
