package com.vybescope.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Vybe Network API access. Bound from VYBE_API_BASE_URL / VYBE_API_KEY in application.yml.
 */
@ConfigurationProperties(prefix = "vybescope.provider")
@NoArgsConstructor
@Getter
@Setter
public class ProviderProperties {

    private String baseUrl = "https://api.vybenetwork.xyz";

    /** Sent as x-api-key. Required; startup fails without it. */
    private String apiKey;

    /** Per-request timeout. Default 10s. */
    private long requestTimeoutMs = 10_000L;

    /** Page size for /token/transfers queries. */
    private int pageLimit = 1000;

    /** Pages read per transfer query before the rest of the window is left for the next tick. */
    private int maxPages = 5;

    /** Transfers younger than this may not be indexed yet; quiet windows only advance up to now minus this lag. */
    private long indexingLagSeconds = 30L;

    /** Wallet transfers at or below this USD value are treated as dust and dropped. */
    private BigDecimal minValueUsd = new BigDecimal("0.01");

    /** Lookback used when a caller passes no lower time bound. Default 5 min. */
    private long defaultLookbackSeconds = 300L;

    /** Global request budget for this instance. */
    private int maxRequestsPerSecond = 10;

    /** How long a call may wait for a local rate-limiter permit before counting as a transient failure. */
    private long limiterTimeoutMs = 2_000L;
}
