package com.vybescope.api.dto;

import com.vybescope.domain.WalletSubscription;

import java.time.Instant;

public record WalletResponse(String address, Instant createdAt) {

    public static WalletResponse from(WalletSubscription subscription) {
        return new WalletResponse(subscription.walletAddress(), subscription.createdAt());
    }
}
