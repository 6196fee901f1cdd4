package com.vybescope.common;

/**
 * Invalid or missing startup configuration (poll intervals, provider credentials).
 * Thrown while the context is being built so the process never starts half-configured.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
