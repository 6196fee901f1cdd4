package com.vybescope.domain;

import java.time.Instant;

/**
 * Dedup ledger entry: when an event identity was first filtered.
 */
public record SeenRecord(String eventId, Instant firstSeenAt) {
}
