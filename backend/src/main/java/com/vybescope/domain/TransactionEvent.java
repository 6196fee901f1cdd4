package com.vybescope.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Normalized transfer fetched from the data provider. Immutable; identity is {@link #eventId()},
 * derived once at fetch time via {@link #deriveEventId} and never recomputed from other fields.
 *
 * @param subject     wallet address or token mint the event was fetched for
 * @param amount      USD notional of the transfer; thresholds compare against this value
 * @param tokenAmount amount in token units, may be null when the provider omits it
 */
public record TransactionEvent(
        String eventId,
        String subject,
        String signature,
        String mintAddress,
        String tokenSymbol,
        BigDecimal amount,
        BigDecimal tokenAmount,
        Instant timestamp,
        EventDirection direction,
        String senderAddress,
        String receiverAddress
) {

    public TransactionEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(direction, "direction");
        amount = amount != null ? amount : BigDecimal.ZERO;
    }

    /**
     * The other side of the transfer from the subject's point of view.
     */
    public String counterpartyAddress() {
        return direction == EventDirection.IN ? senderAddress : receiverAddress;
    }

    /**
     * Deterministic identity: signature, mint and direction as seen from the subject.
     */
    public static String deriveEventId(String signature, String mintAddress, EventDirection direction, String subject) {
        return signature + ":" + (mintAddress != null ? mintAddress : "-") + ":" + direction.name() + ":" + subject;
    }
}
