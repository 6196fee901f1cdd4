package com.vybescope.alert;

import com.vybescope.alert.config.AlertProperties;
import com.vybescope.alert.config.PollSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DedupEvictionJobTest {

    @Test
    void runScheduled_evictsRecordsOlderThanRetention() {
        SeenEventStoreTest.MutableClock clock = new SeenEventStoreTest.MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        SeenEventStore store = new SeenEventStore(clock);
        store.markAndCheck("day-one");
        clock.now = Instant.parse("2025-01-01T20:00:00Z");
        store.markAndCheck("same-day");
        clock.now = Instant.parse("2025-01-02T06:00:00Z");
        DedupEvictionJob job = new DedupEvictionJob(store, PollSchedule.from(new AlertProperties()), clock);

        job.runScheduled();

        assertThat(store.contains("day-one")).isFalse();
        assertThat(store.contains("same-day")).isTrue();
    }
}
