package com.camsentinel.core.model;

import java.util.Objects;

/**
 * A live event subscription on one device.
 *
 * <p>
 * {@code renewBeforeNanos} is expressed on the local monotonic clock: the
 * subscription must be renewed once that instant is reached. Instances are
 * immutable; a renewal produces a new instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class Subscription {

    private final String deviceName;
    private final String endpointReference;
    private final long renewBeforeNanos;

    public Subscription(String deviceName, String endpointReference, long renewBeforeNanos) {
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName must not be null");
        this.endpointReference = Objects.requireNonNull(endpointReference,
                "endpointReference must not be null");
        this.renewBeforeNanos = renewBeforeNanos;
    }

    public String getDeviceName() {
        return deviceName;
    }

    /** @return address the device assigned to this subscription */
    public String getEndpointReference() {
        return endpointReference;
    }

    public long getRenewBeforeNanos() {
        return renewBeforeNanos;
    }

    public Subscription withRenewBefore(long renewBeforeNanos) {
        return new Subscription(deviceName, endpointReference, renewBeforeNanos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Subscription that))
            return false;
        return renewBeforeNanos == that.renewBeforeNanos
                && deviceName.equals(that.deviceName)
                && endpointReference.equals(that.endpointReference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(deviceName, endpointReference, renewBeforeNanos);
    }

    @Override
    public String toString() {
        return "Subscription{deviceName='" + deviceName + "', endpointReference='"
                + endpointReference + "'}";
    }
}
