package com.vybescope.api.dto;

import java.util.Arrays;

public enum ErrorCode {
    INVALID_ADDRESS("Invalid wallet address format"),
    INVALID_THRESHOLD("Whale alert threshold must be zero or positive"),
    INVALID_REQUEST("Malformed request"),
    VALIDATION_ERROR("Validation failed"),
    PROVIDER_UNAVAILABLE("Data provider is temporarily unavailable"),
    INTERNAL_ERROR("Internal error");

    private final String defaultMessage;

    ErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    /**
     * Constraint annotations carry the error code as their message; anything else is a generic validation error.
     */
    public static ErrorCode fromConstraintMessage(String message) {
        return Arrays.stream(values())
                .filter(code -> code.name().equals(message))
                .findFirst()
                .orElse(VALIDATION_ERROR);
    }
}
