package com.camsentinel.core.pipeline;

/**
 * A device pipeline gave up, for example after exhausting its configured
 * reconnect attempts. Scoped to one device; the supervisor decides whether
 * to restart it.
 */
public class PipelineFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
