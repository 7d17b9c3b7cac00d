package com.camsentinel.core.recording;

/**
 * Lifecycle of a {@link RecordingSession}. {@link #STOPPED} is terminal.
 */
public enum SessionStatus {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
