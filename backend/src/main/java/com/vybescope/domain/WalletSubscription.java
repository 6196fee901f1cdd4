package com.vybescope.domain;

import java.time.Instant;

/**
 * A user tracking a wallet. Unique per (userId, walletAddress).
 */
public record WalletSubscription(long userId, String walletAddress, Instant createdAt) {
}
