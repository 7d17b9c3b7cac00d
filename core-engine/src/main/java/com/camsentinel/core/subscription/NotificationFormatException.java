package com.camsentinel.core.subscription;

/**
 * A notification matched the person topic but could not be interpreted.
 */
public class NotificationFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    public NotificationFormatException(String message) {
        super(message);
    }
}
