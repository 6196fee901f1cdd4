package com.vybescope.alert;

import com.vybescope.domain.SeenRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory dedup ledger. {@link #markAndCheck} is the single point where a candidate event
 * becomes "seen"; concurrent callers for the same id get exactly one {@code true}.
 */
@Component
@RequiredArgsConstructor
public class SeenEventStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, SeenRecord> seen = new ConcurrentHashMap<>();

    /**
     * @return true if the id was not present and is now recorded
     */
    public boolean markAndCheck(String eventId) {
        if (eventId == null) {
            return false;
        }
        return seen.putIfAbsent(eventId, new SeenRecord(eventId, clock.instant())) == null;
    }

    public boolean contains(String eventId) {
        return eventId != null && seen.containsKey(eventId);
    }

    /**
     * Removes records first seen strictly before {@code olderThan}.
     *
     * @return number of removed records
     */
    public int evict(Instant olderThan) {
        int removed = 0;
        for (SeenRecord record : seen.values()) {
            if (record.firstSeenAt().isBefore(olderThan) && seen.remove(record.eventId(), record)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return seen.size();
    }
}
