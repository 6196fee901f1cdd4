package com.vybescope.subscription;

/**
 * Internal registry state is inconsistent. Indicates a programming error, never a user mistake.
 */
public class RegistryInvariantViolationException extends RuntimeException {

    public RegistryInvariantViolationException(String message) {
        super(message);
    }
}
