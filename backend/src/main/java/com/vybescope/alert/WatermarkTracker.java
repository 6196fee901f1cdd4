package com.vybescope.alert;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-entity "fetched up to" timestamps. Watermarks only move forward.
 */
public class WatermarkTracker {

    private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();

    public Instant sinceFor(String key, Instant fallback) {
        return watermarks.getOrDefault(key, fallback);
    }

    public Optional<Instant> get(String key) {
        return Optional.ofNullable(watermarks.get(key));
    }

    /**
     * Moves the watermark to {@code candidate} unless it already is at or beyond it.
     */
    public void advance(String key, Instant candidate) {
        if (key == null || candidate == null) {
            return;
        }
        watermarks.merge(key, candidate, (current, next) -> next.isAfter(current) ? next : current);
    }

    /**
     * Drops watermarks of entities that are no longer tracked.
     */
    public void retainOnly(Set<String> keys) {
        watermarks.keySet().retainAll(keys);
    }

    public int size() {
        return watermarks.size();
    }
}
