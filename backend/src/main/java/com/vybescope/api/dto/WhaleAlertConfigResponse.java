package com.vybescope.api.dto;

import com.vybescope.domain.WhaleAlertConfig;

import java.math.BigDecimal;
import java.util.List;

public record WhaleAlertConfigResponse(long userId, List<String> tokens, BigDecimal threshold, boolean enabled) {

    public static WhaleAlertConfigResponse from(WhaleAlertConfig config) {
        return new WhaleAlertConfigResponse(
                config.userId(),
                List.copyOf(config.tokenMints()),
                config.thresholdAmount(),
                config.enabled());
    }
}
