package com.vybescope.domain;

/**
 * Direction of a transfer relative to the tracked subject.
 * Token-scoped events (whale alerts) have no wallet perspective and use {@link #TRANSFER}.
 */
public enum EventDirection {
    IN,
    OUT,
    TRANSFER
}
