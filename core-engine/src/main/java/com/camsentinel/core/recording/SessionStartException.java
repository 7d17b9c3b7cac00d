package com.camsentinel.core.recording;

/**
 * A recording session could not be started: its output paths could not be
 * allocated or the capture process could not be launched. No session exists
 * after this is thrown.
 */
public class SessionStartException extends Exception {

    private static final long serialVersionUID = 1L;

    public SessionStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
