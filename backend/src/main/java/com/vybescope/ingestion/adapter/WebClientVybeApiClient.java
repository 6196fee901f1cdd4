package com.vybescope.ingestion.adapter;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Vybe API client using WebClient. Authenticates with the x-api-key header.
 */
public class WebClientVybeApiClient implements VybeApiClient {

    private static final String API_KEY_HEADER = "x-api-key";

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientVybeApiClient(WebClient.Builder builder, String baseUrl, String apiKey, Duration timeout) {
        this.webClient = builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(API_KEY_HEADER, apiKey)
                .build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> get(String path, Map<String, ?> queryParams) {
        return webClient.get()
                .uri(uriBuilder -> {
                    uriBuilder.path(path);
                    if (queryParams != null) {
                        queryParams.forEach((name, value) -> {
                            if (value != null) {
                                uriBuilder.queryParam(name, value);
                            }
                        });
                    }
                    return uriBuilder.build();
                })
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new VybeApiException(e.getStatusCode().value(), e.getMessage(), e));
    }
}
