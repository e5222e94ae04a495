package com.reclaimradar.ingestion.adapter.spapi;

import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

/**
 * Raw HTTP access to Selling Partner API and Login with Amazon. Errors are mapped to
 * {@link com.reclaimradar.ingestion.adapter.ReportProviderException}.
 */
public interface SpApiClient {

    Mono<String> get(String url, String accessToken);

    Mono<String> postJson(String url, String accessToken, Object body);

    Mono<String> postForm(String url, MultiValueMap<String, String> form);

    /** Pre-signed document download; no access token. */
    Mono<byte[]> download(String url);
}
