package com.vybescope.alert;

/**
 * IDLE between ticks, RUNNING during one, SUSPENDED when disabled by configuration or at runtime.
 */
public enum CycleState {
    IDLE,
    RUNNING,
    SUSPENDED
}
