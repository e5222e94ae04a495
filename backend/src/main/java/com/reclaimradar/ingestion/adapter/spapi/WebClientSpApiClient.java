package com.reclaimradar.ingestion.adapter.spapi;

import com.reclaimradar.ingestion.adapter.ProviderErrorKind;
import com.reclaimradar.ingestion.adapter.ReportProviderException;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * SP-API client using WebClient. Used by SpApiReportProvider and LwaAccessTokenProvider.
 */
public class WebClientSpApiClient implements SpApiClient {

    static final String ACCESS_TOKEN_HEADER = "x-amz-access-token";

    private final WebClient webClient;
    private final Duration requestTimeout;

    public WebClientSpApiClient(WebClient.Builder builder, Duration requestTimeout) {
        this.webClient = builder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                .build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<String> get(String url, String accessToken) {
        return mapErrors(webClient.get()
                .uri(url)
                .header(ACCESS_TOKEN_HEADER, accessToken)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class), url);
    }

    @Override
    public Mono<String> postJson(String url, String accessToken, Object body) {
        return mapErrors(webClient.post()
                .uri(url)
                .header(ACCESS_TOKEN_HEADER, accessToken)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class), url);
    }

    @Override
    public Mono<String> postForm(String url, MultiValueMap<String, String> form) {
        return mapErrors(webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(String.class), url);
    }

    @Override
    public Mono<byte[]> download(String url) {
        return mapErrors(webClient.get()
                .uri(java.net.URI.create(url))
                .retrieve()
                .bodyToMono(byte[].class), "report document");
    }

    private <T> Mono<T> mapErrors(Mono<T> call, String target) {
        return call
                .timeout(requestTimeout)
                .onErrorMap(WebClientResponseException.class, e -> new ReportProviderException(
                        ProviderErrorKind.fromHttpStatus(e.getStatusCode().value()),
                        "HTTP " + e.getStatusCode().value() + " from " + target + ": " + e.getResponseBodyAsString(), e))
                .onErrorMap(WebClientRequestException.class, e -> new ReportProviderException(
                        ProviderErrorKind.TRANSIENT, "Request to " + target + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new ReportProviderException(
                        ProviderErrorKind.TRANSIENT, "Request to " + target + " timed out after " + requestTimeout.toMillis() + " ms", e));
    }
}
