package com.vybescope.alert;

import com.vybescope.alert.config.PollSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically drops dedup records older than the retention horizon of {@link PollSchedule}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DedupEvictionJob {

    private final SeenEventStore seenEventStore;
    private final PollSchedule pollSchedule;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${vybescope.alerts.dedup.eviction-interval-ms:3600000}",
            initialDelayString = "${vybescope.alerts.dedup.eviction-interval-ms:3600000}")
    public void runScheduled() {
        Instant horizon = clock.instant().minus(pollSchedule.dedupRetention());
        int removed = seenEventStore.evict(horizon);
        if (removed > 0) {
            log.info("Evicted {} dedup records older than {} ({} remaining)", removed, horizon, seenEventStore.size());
        } else {
            log.debug("Dedup eviction: nothing older than {}", horizon);
        }
    }
}
