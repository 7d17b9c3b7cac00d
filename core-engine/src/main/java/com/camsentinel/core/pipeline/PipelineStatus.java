package com.camsentinel.core.pipeline;

/**
 * Point-in-time view of one device pipeline, safe to hand to other threads.
 *
 * @since 1.0.0
 */
public final class PipelineStatus {

    private final String deviceName;
    private final PipelineState state;
    private final String activeSessionId;
    private final long sessionsStarted;
    private final long processFaults;
    private final long connectFailures;
    private final int restarts;
    private final String lastError;

    public PipelineStatus(String deviceName, PipelineState state, String activeSessionId,
            long sessionsStarted, long processFaults, long connectFailures, int restarts, String lastError) {
        this.deviceName = deviceName;
        this.state = state;
        this.activeSessionId = activeSessionId;
        this.sessionsStarted = sessionsStarted;
        this.processFaults = processFaults;
        this.connectFailures = connectFailures;
        this.restarts = restarts;
        this.lastError = lastError;
    }

    PipelineStatus withRestarts(int restarts) {
        return new PipelineStatus(deviceName, state, activeSessionId, sessionsStarted, processFaults,
                connectFailures, restarts, lastError);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public PipelineState getState() {
        return state;
    }

    public boolean isRecording() {
        return activeSessionId != null;
    }

    /** @return id of the running session, or {@code null} */
    public String getActiveSessionId() {
        return activeSessionId;
    }

    public long getSessionsStarted() {
        return sessionsStarted;
    }

    public long getProcessFaults() {
        return processFaults;
    }

    public long getConnectFailures() {
        return connectFailures;
    }

    public int getRestarts() {
        return restarts;
    }

    /** @return message of the most recent error, or {@code null} */
    public String getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "PipelineStatus{" +
                "deviceName='" + deviceName + '\'' +
                ", state=" + state +
                ", activeSessionId='" + activeSessionId + '\'' +
                ", sessionsStarted=" + sessionsStarted +
                ", connectFailures=" + connectFailures +
                ", restarts=" + restarts +
                '}';
    }
}
