package com.vybescope.api.dto;

import java.time.Instant;

/**
 * Error payload of every non-2xx API response. {@code error} is an {@link ErrorCode} name the chat
 * front end switches on; {@code message} is for logs and humans only.
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    public static ErrorBody of(ErrorCode code, String message) {
        return new ErrorBody(code.name(), message != null ? message : code.defaultMessage(), Instant.now());
    }

    public static ErrorBody of(ErrorCode code) {
        return of(code, code.defaultMessage());
    }
}
