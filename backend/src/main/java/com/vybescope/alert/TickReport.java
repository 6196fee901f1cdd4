package com.vybescope.alert;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one completed tick, kept as the cycle's last report.
 *
 * @param entities       distinct wallets or mints polled
 * @param failedEntities entities skipped because the provider was unavailable
 * @param candidates     events returned by the provider after filtering
 * @param newEvents      candidates that passed dedup
 * @param intents        notification intents handed to the sink
 * @param interrupted    true if shutdown stopped the tick before all candidates were marked
 */
public record TickReport(
        CycleType cycle,
        Instant startedAt,
        Duration duration,
        int entities,
        int failedEntities,
        int candidates,
        int newEvents,
        int intents,
        boolean interrupted
) {

    public static TickReport noWork(CycleType cycle, Instant startedAt) {
        return new TickReport(cycle, startedAt, Duration.ZERO, 0, 0, 0, 0, 0, false);
    }
}
