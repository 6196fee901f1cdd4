package com.vybescope.api.dto;

import com.vybescope.api.validation.SolanaAddress;

import java.math.BigDecimal;
import java.util.List;

/**
 * PUT /api/v1/users/{userId}/whale-alert request body. Replaces the whole config.
 * A null threshold means the default (50000 USD); a null enabled flag means true.
 */
public record WhaleAlertConfigRequest(
        List<@SolanaAddress String> tokens,
        BigDecimal threshold,
        Boolean enabled
) {
}
