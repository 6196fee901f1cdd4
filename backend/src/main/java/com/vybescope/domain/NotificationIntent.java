package com.vybescope.domain;

import java.time.Instant;

/**
 * Pre-delivery "this user should be told about this event". Not persisted beyond the sink handoff.
 */
public record NotificationIntent(long userId, NotificationKind kind, TransactionEvent payload, Instant generatedAt) {
}
