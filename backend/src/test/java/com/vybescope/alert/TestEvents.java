package com.vybescope.alert;

import com.vybescope.domain.EventDirection;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.TransferBatch;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

final class TestEvents {

    static final String USDC = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    private TestEvents() {
    }

    static TransactionEvent walletIn(String signature, String wallet, Instant at, String usd) {
        return new TransactionEvent(
                TransactionEvent.deriveEventId(signature, USDC, EventDirection.IN, wallet),
                wallet, signature, USDC, "USDC", new BigDecimal(usd), new BigDecimal(usd), at,
                EventDirection.IN, "sender" + signature, wallet);
    }

    static TransactionEvent tokenTransfer(String signature, String mint, Instant at, String usd) {
        return new TransactionEvent(
                TransactionEvent.deriveEventId(signature, mint, EventDirection.TRANSFER, mint),
                mint, signature, mint, "USDC", new BigDecimal(usd), new BigDecimal(usd), at,
                EventDirection.TRANSFER, "from" + signature, "to" + signature);
    }

    static TransferBatch batch(TransactionEvent... events) {
        return TransferBatch.of(List.of(events));
    }
}
