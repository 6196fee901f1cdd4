package com.vybescope.api.dto;

import com.vybescope.alert.CycleState;
import com.vybescope.alert.CycleType;
import com.vybescope.alert.PollCycle;
import com.vybescope.alert.TickReport;

/**
 * GET /api/v1/cycles entry. {@code lastTick} is null until the first tick completes.
 */
public record CycleStatusResponse(
        CycleType cycle,
        CycleState state,
        long intervalSeconds,
        long completedTicks,
        long skippedTicks,
        TickReport lastTick
) {

    public static CycleStatusResponse from(PollCycle cycle, long intervalSeconds) {
        return new CycleStatusResponse(
                cycle.type(),
                cycle.state(),
                intervalSeconds,
                cycle.completedTicks(),
                cycle.skippedTicks(),
                cycle.lastReport());
    }
}
