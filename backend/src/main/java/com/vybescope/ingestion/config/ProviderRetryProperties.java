package com.vybescope.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Provider retry policy (exponential backoff ± jitter).
 */
@ConfigurationProperties(prefix = "vybescope.provider.retry")
@NoArgsConstructor
@Getter
@Setter
public class ProviderRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Total attempts including the first call. Default 3. */
    private int maxAttempts = 3;
}
