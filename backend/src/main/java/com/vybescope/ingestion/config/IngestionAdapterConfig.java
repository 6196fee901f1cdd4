package com.vybescope.ingestion.config;

import com.vybescope.common.ConfigurationException;
import com.vybescope.common.RetryPolicy;
import com.vybescope.ingestion.adapter.VybeApiClient;
import com.vybescope.ingestion.adapter.WebClientVybeApiClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Vybe API client with its retry policy and local rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ ProviderProperties.class, ProviderRetryProperties.class })
public class IngestionAdapterConfig {

    public static final String PROVIDER_RETRY_POLICY = "providerRetryPolicy";
    public static final String PROVIDER_RATE_LIMITER = "vybeApiRateLimiter";

    @Bean
    public VybeApiClient vybeApiClient(WebClient.Builder webClientBuilder, ProviderProperties properties) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new ConfigurationException("vybescope.provider.api-key (VYBE_API_KEY) is required");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new ConfigurationException("vybescope.provider.base-url (VYBE_API_BASE_URL) must not be blank");
        }
        return new WebClientVybeApiClient(
                webClientBuilder,
                properties.getBaseUrl(),
                properties.getApiKey(),
                Duration.ofMillis(Math.max(1L, properties.getRequestTimeoutMs())));
    }

    @Bean(name = PROVIDER_RETRY_POLICY)
    public RetryPolicy providerRetryPolicy(ProviderRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                Math.max(1, retryProperties.getMaxAttempts()));
    }

    @Bean(name = PROVIDER_RATE_LIMITER)
    public RateLimiter vybeApiRateLimiter(ProviderProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("vybe-api", config);
    }
}
