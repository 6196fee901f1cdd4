package com.vybescope.alert.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Poll cycle configuration. Intervals come from WALLET_TRACKING_INTERVAL_SECONDS and
 * WHALE_ALERT_INTERVAL_SECONDS; they are validated into {@link PollSchedule} at startup.
 */
@ConfigurationProperties(prefix = "vybescope.alerts")
@NoArgsConstructor
@Getter
@Setter
public class AlertProperties {

    private Cycle walletTracking = new Cycle();

    private Cycle whaleAlert = new Cycle();

    /** Max concurrent per-entity provider fetches across both cycles. */
    private int fetchConcurrency = 4;

    private Dedup dedup = new Dedup();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Cycle {

        /** Disabled cycles stay SUSPENDED and are never triggered. */
        private boolean enabled = true;

        /** Trigger period in seconds. Must be positive. */
        private long intervalSeconds = 120;

        /** Delay before the first trigger; negative means "same as interval". */
        private long initialDelaySeconds = -1;

        /** Lookback for an entity's first fetch; negative means "same as interval". */
        private long initialLookbackSeconds = -1;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Dedup {

        /** Retention is at least this many ticks of the slower cycle, and never below 24 hours. */
        private int retentionTicks = 10;

        /** How often (ms) the eviction job runs. Default hourly. */
        private long evictionIntervalMs = 3_600_000;
    }
}
