package com.vybescope.api.dto;

import com.vybescope.api.validation.SolanaAddress;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/users/{userId}/wallets request body.
 */
public record AddWalletRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @SolanaAddress
        String address
) {
}
