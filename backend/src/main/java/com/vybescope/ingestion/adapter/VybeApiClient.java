package com.vybescope.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Vybe REST API abstraction for testing. Returns the raw JSON body; retries and rate limiting are
 * handled by {@link VybeDataSourceClient}.
 */
public interface VybeApiClient {

    /**
     * GET {@code path} with the given query parameters; null values are omitted.
     */
    Mono<String> get(String path, Map<String, ?> queryParams);
}
