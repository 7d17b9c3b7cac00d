package com.camsentinel.core.pipeline;

/**
 * Coarse lifecycle of a device pipeline, as reported to operators.
 */
public enum PipelineState {
    CREATED,
    CONNECTING,
    WATCHING,
    RECONNECTING,
    STOPPING,
    STOPPED,
    FAILED
}
