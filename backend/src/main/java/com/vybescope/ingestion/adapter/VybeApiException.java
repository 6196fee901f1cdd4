package com.vybescope.ingestion.adapter;

import lombok.Getter;

/**
 * Thrown when a Vybe API call fails with an HTTP error or an unusable body.
 */
@Getter
public class VybeApiException extends RuntimeException {

    /** HTTP status, or 0 when the failure did not come with a response. */
    private final int statusCode;

    public VybeApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public VybeApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 429, 5xx and response-less failures are worth retrying; other 4xx are not.
     */
    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
