package com.reclaimradar.ingestion.adapter.spapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reclaimradar.config.CaffeineConfig;
import com.reclaimradar.ingestion.adapter.ProviderErrorKind;
import com.reclaimradar.ingestion.adapter.ReportProviderException;
import com.reclaimradar.ingestion.config.ProviderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.io.IOException;

/**
 * Exchanges the seller's refresh token for a Login with Amazon access token.
 * Tokens are cached per client id for slightly less than their one-hour lifetime.
 */
@Slf4j
@RequiredArgsConstructor
public class LwaAccessTokenProvider {

    private final SpApiClient client;
    private final ProviderProperties properties;
    private final ObjectMapper objectMapper;

    @Cacheable(cacheNames = CaffeineConfig.LWA_TOKEN_CACHE, key = "#root.target.cacheKey()")
    public String accessToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", properties.getRefreshToken());
        form.add("client_id", properties.getClientId());
        form.add("client_secret", properties.getClientSecret());
        String json = client.postForm(properties.getTokenEndpoint(), form).block();
        String token = readToken(json);
        log.debug("Obtained LWA access token for client {}", properties.getClientId());
        return token;
    }

    public String cacheKey() {
        return properties.getClientId() != null ? properties.getClientId() : "";
    }

    private String readToken(String json) {
        try {
            JsonNode root = objectMapper.readTree(json == null ? "" : json);
            JsonNode token = root.path("access_token");
            if (token.isMissingNode() || token.asText().isBlank()) {
                throw new ReportProviderException(ProviderErrorKind.AUTH, "LWA response carries no access_token");
            }
            return token.asText();
        } catch (IOException e) {
            throw new ReportProviderException(ProviderErrorKind.FATAL, "Unreadable LWA token response", e);
        }
    }
}
