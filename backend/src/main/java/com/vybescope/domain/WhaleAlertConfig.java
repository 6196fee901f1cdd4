package com.vybescope.domain;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Whale-alert settings of one user. Replaced as a whole on every settings change.
 *
 * @param tokenMints      insertion-ordered, unmodifiable
 * @param thresholdAmount minimum USD notional that triggers an alert (inclusive), never negative
 */
public record WhaleAlertConfig(long userId, Set<String> tokenMints, BigDecimal thresholdAmount, boolean enabled) {

    /** Threshold used when the user never set one. */
    public static final BigDecimal DEFAULT_THRESHOLD = new BigDecimal("50000");

    public static WhaleAlertConfig disabled(long userId) {
        return new WhaleAlertConfig(userId, Set.of(), DEFAULT_THRESHOLD, false);
    }

    /**
     * True when this config should contribute work to a whale-alert tick.
     */
    public boolean isActive() {
        return enabled && tokenMints != null && !tokenMints.isEmpty();
    }

    public boolean isMetBy(BigDecimal amount) {
        return amount != null && amount.compareTo(thresholdAmount) >= 0;
    }
}
