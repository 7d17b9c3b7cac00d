package com.camsentinel.core.detection;

/**
 * Per-device detection state.
 */
public enum DetectionState {

    /** No recording is running. */
    IDLE,

    /** A recording is running, including its post-detection tail. */
    ACTIVE
}
