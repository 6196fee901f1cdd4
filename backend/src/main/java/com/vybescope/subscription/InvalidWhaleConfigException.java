package com.vybescope.subscription;

/**
 * Whale-alert settings rejected, e.g. a negative threshold.
 */
public class InvalidWhaleConfigException extends RuntimeException {

    public InvalidWhaleConfigException(String message) {
        super(message);
    }
}
