package com.camsentinel.core.subscription;

/**
 * A device could not be reached, refused our credentials, or dropped a live
 * subscription.
 *
 * <p>
 * Recoverable: the owning pipeline backs off and reconnects.
 * </p>
 */
public class DeviceConnectException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String deviceName;

    public DeviceConnectException(String deviceName, String message, Throwable cause) {
        super(message, cause);
        this.deviceName = deviceName;
    }

    public String getDeviceName() {
        return deviceName;
    }
}
