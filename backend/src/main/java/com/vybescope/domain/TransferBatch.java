package com.vybescope.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Transfers fetched for one wallet or mint, ascending by timestamp, plus how far the provider window
 * was actually read.
 *
 * @param events       transfers with timestamp strictly after the requested lower bound
 * @param coveredUntil every provider transfer up to this instant was read; null when the batch
 *                     claims nothing beyond its own events
 * @param truncated    the page budget ran out before the window was exhausted; events may exist
 *                     after {@code coveredUntil} that this batch does not hold
 */
public record TransferBatch(List<TransactionEvent> events, Instant coveredUntil, boolean truncated) {

    public TransferBatch {
        events = List.copyOf(Objects.requireNonNull(events, "events"));
        if (truncated) {
            Objects.requireNonNull(coveredUntil, "coveredUntil");
        }
    }

    public static TransferBatch of(List<TransactionEvent> events) {
        return new TransferBatch(events, null, false);
    }

    public static TransferBatch complete(List<TransactionEvent> events, Instant coveredUntil) {
        return new TransferBatch(events, coveredUntil, false);
    }

    /**
     * Lower bound for the next fetch of this entity. A truncated batch never moves past
     * {@link #coveredUntil()}, so the unread remainder is fetched next time. Never earlier than {@code since}.
     */
    public Instant nextWatermark(Instant since) {
        Instant next = since;
        if (!truncated) {
            for (TransactionEvent e : events) {
                if (e.timestamp().isAfter(next)) {
                    next = e.timestamp();
                }
            }
        }
        if (coveredUntil != null && coveredUntil.isAfter(next)) {
            next = coveredUntil;
        }
        return next;
    }
}
