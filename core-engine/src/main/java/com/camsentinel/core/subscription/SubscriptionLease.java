package com.camsentinel.core.subscription;

import java.time.Duration;
import java.util.Objects;

/**
 * What a device granted when a subscription was created or renewed.
 *
 * <p>
 * The lifetime is relative, so the device's clock never has to agree with
 * ours.
 * </p>
 */
public final class SubscriptionLease {

    private final String endpointReference;
    private final Duration validFor;

    public SubscriptionLease(String endpointReference, Duration validFor) {
        this.endpointReference = Objects.requireNonNull(endpointReference,
                "endpointReference must not be null");
        this.validFor = Objects.requireNonNull(validFor, "validFor must not be null");
    }

    public String getEndpointReference() {
        return endpointReference;
    }

    public Duration getValidFor() {
        return validFor;
    }

    @Override
    public String toString() {
        return "SubscriptionLease{endpointReference='" + endpointReference + "', validFor=" + validFor + '}';
    }
}
