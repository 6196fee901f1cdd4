package com.vybescope.ingestion.config;

import com.vybescope.common.ConfigurationException;
import com.vybescope.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionAdapterConfigTest {

    private final IngestionAdapterConfig config = new IngestionAdapterConfig();

    @Test
    void vybeApiClient_missingApiKey_failsFast() {
        ProviderProperties properties = new ProviderProperties();
        properties.setApiKey(" ");

        assertThatThrownBy(() -> config.vybeApiClient(WebClient.builder(), properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("VYBE_API_KEY");
    }

    @Test
    void vybeApiClient_withKey_isCreated() {
        ProviderProperties properties = new ProviderProperties();
        properties.setApiKey("key");

        assertThat(config.vybeApiClient(WebClient.builder(), properties)).isNotNull();
    }

    @Test
    void providerRetryPolicy_usesConfiguredAttempts() {
        ProviderRetryProperties retry = new ProviderRetryProperties();
        retry.setMaxAttempts(4);
        retry.setJitterFactor(0);
        retry.setBaseDelayMs(250);

        RetryPolicy policy = config.providerRetryPolicy(retry);

        assertThat(policy.getMaxAttempts()).isEqualTo(4);
        assertThat(policy.delayMs(1)).isEqualTo(500L);
    }

    @Test
    void vybeApiRateLimiter_limitsPerSecond() {
        ProviderProperties properties = new ProviderProperties();
        properties.setMaxRequestsPerSecond(7);

        RateLimiter limiter = config.vybeApiRateLimiter(properties);

        assertThat(limiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(7);
        assertThat(limiter.getRateLimiterConfig().getLimitRefreshPeriod()).isEqualTo(Duration.ofSeconds(1));
        assertThat(limiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(2000));
    }
}
