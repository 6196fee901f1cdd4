package com.vybescope.alert.config;

import com.vybescope.alert.CycleType;
import com.vybescope.common.ConfigurationException;

import java.time.Duration;

/**
 * Validated, immutable view of {@link AlertProperties}.
 */
public record PollSchedule(CycleSettings walletTracking, CycleSettings whaleAlert, Duration dedupRetention) {

    /** Floor for dedup retention regardless of intervals. */
    public static final Duration MIN_DEDUP_RETENTION = Duration.ofHours(24);

    public record CycleSettings(boolean enabled, Duration interval, Duration initialDelay, Duration initialLookback) {
    }

    public CycleSettings settingsFor(CycleType type) {
        return type == CycleType.WALLET_TRACKING ? walletTracking : whaleAlert;
    }

    /**
     * @throws ConfigurationException when an interval is not positive
     */
    public static PollSchedule from(AlertProperties properties) {
        CycleSettings wallet = cycle("wallet-tracking", properties.getWalletTracking());
        CycleSettings whale = cycle("whale-alert", properties.getWhaleAlert());
        int ticks = Math.max(1, properties.getDedup().getRetentionTicks());
        Duration slowest = wallet.interval().compareTo(whale.interval()) >= 0 ? wallet.interval() : whale.interval();
        Duration byTicks = slowest.multipliedBy(ticks);
        Duration retention = byTicks.compareTo(MIN_DEDUP_RETENTION) >= 0 ? byTicks : MIN_DEDUP_RETENTION;
        return new PollSchedule(wallet, whale, retention);
    }

    private static CycleSettings cycle(String name, AlertProperties.Cycle c) {
        if (c == null) {
            throw new ConfigurationException("vybescope.alerts." + name + " is missing");
        }
        if (c.getIntervalSeconds() <= 0) {
            throw new ConfigurationException(
                    "vybescope.alerts." + name + ".interval-seconds must be > 0, was " + c.getIntervalSeconds());
        }
        Duration interval = Duration.ofSeconds(c.getIntervalSeconds());
        Duration initialDelay = c.getInitialDelaySeconds() < 0 ? interval : Duration.ofSeconds(c.getInitialDelaySeconds());
        Duration lookback = c.getInitialLookbackSeconds() <= 0 ? interval : Duration.ofSeconds(c.getInitialLookbackSeconds());
        return new CycleSettings(c.isEnabled(), interval, initialDelay, lookback);
    }
}
