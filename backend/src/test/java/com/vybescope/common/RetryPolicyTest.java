package com.vybescope.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void delayMs_attemptZero_returnsJitteredBaseDelay() {
        RetryPolicy policy = new RetryPolicy(500L, 0.2, 3);
        for (int i = 0; i < 20; i++) {
            long d = policy.delayMs(0);
            assertThat(d).isBetween(400L, 600L); // ±20% of 500
        }
    }

    @Test
    void delayMs_exponentialIncreases() {
        RetryPolicy policy = new RetryPolicy(100L, 0, 5); // no jitter for deterministic test
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
    }

    @Test
    void defaultPolicy_hasThreeAttempts() {
        assertThat(RetryPolicy.defaultPolicy().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void constructor_zeroAttempts_throws() {
        assertThatThrownBy(() -> new RetryPolicy(100L, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
