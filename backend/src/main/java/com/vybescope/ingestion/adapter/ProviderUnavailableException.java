package com.vybescope.ingestion.adapter;

import lombok.Getter;

/**
 * The provider could not serve a request after retries were exhausted, or rejected it outright.
 * Pollers skip the affected entity for the current tick; passthrough reads surface it as 503.
 */
@Getter
public class ProviderUnavailableException extends RuntimeException {

    /** HTTP status of the last failure, 0 if none. */
    private final int statusCode;

    public ProviderUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
