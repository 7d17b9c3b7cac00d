package com.camsentinel.core.subscription;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.model.RawNotification;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Contract for the wire-level event protocol of one kind of device.
 *
 * <p>
 * Implementations own authentication and encoding; the
 * {@link SubscriptionClient} owns timing, renewal and failure policy. Every
 * method may block on network I/O and reports failures as
 * {@link IOException}.
 * </p>
 */
public interface EventSubscriptionTransport {

    /**
     * Create a subscription on the device.
     *
     * @param device   target device
     * @param validFor lifetime to request
     * @return the endpoint reference and the lifetime the device granted
     * @throws IOException on network, authentication or protocol failure
     */
    SubscriptionLease subscribe(DeviceConfig device, Duration validFor) throws IOException;

    /**
     * Extend an existing subscription.
     *
     * @param device            target device
     * @param endpointReference address returned by {@link #subscribe}
     * @param validFor          lifetime to request
     * @return the lifetime the device granted
     * @throws IOException if the device refused or could not be reached
     */
    SubscriptionLease renew(DeviceConfig device, String endpointReference, Duration validFor)
            throws IOException;

    /**
     * Wait up to {@code timeout} for notifications.
     *
     * @param device            target device
     * @param endpointReference address returned by {@link #subscribe}
     * @param timeout           maximum wait
     * @param limit             maximum number of notifications to return
     * @return received notifications in arrival order, empty on timeout
     * @throws IOException if the subscription is no longer usable
     */
    List<RawNotification> pull(DeviceConfig device, String endpointReference, Duration timeout, int limit)
            throws IOException;

    /**
     * Release the subscription on the device.
     *
     * @param device            target device
     * @param endpointReference address returned by {@link #subscribe}
     * @throws IOException if the device could not be reached
     */
    void unsubscribe(DeviceConfig device, String endpointReference) throws IOException;
}
