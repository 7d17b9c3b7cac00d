package com.camsentinel.core.config;

/**
 * Invalid startup configuration.
 *
 * <p>
 * Always fatal: the watcher refuses to start any device pipeline while the
 * configuration is invalid.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
