package com.camsentinel.core.subscription;

import com.camsentinel.core.model.DetectionEvent;
import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.model.RawNotification;
import com.camsentinel.core.model.Subscription;
import com.camsentinel.core.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maintains the event subscription of one device and surfaces its presence
 * notifications as {@link DetectionEvent}s.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #connect()} creates the subscription, {@link #nextEvent(Duration)}
 * is called repeatedly to consume events, {@link #close()} releases it. A
 * failed renewal or receive closes the subscription and surfaces as a
 * {@link DeviceConnectException}; the caller is expected to back off and
 * {@link #connect()} again.
 * </p>
 *
 * <h3>Renewal</h3>
 * <p>
 * The subscription is renewed once the local clock is within the configured
 * margin of its expiry. Waits inside {@link #nextEvent(Duration)} never
 * extend past the renewal point.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. One instance belongs to exactly one pipeline thread.
 * </p>
 *
 * @since 1.0.0
 */
public class SubscriptionClient implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionClient.class);

    private final DeviceConfig device;
    private final EventSubscriptionTransport transport;
    private final NotificationParser parser;
    private final TimeSource time;
    private final Duration subscriptionDuration;
    private final Duration renewMargin;
    private final int pullLimit;

    /** Notifications received in a batch but not yet handed out. */
    private final Deque<RawNotification> pending = new ArrayDeque<>();

    private Subscription subscription;

    /**
     * @param device               the device to subscribe to
     * @param transport            wire protocol implementation
     * @param parser               notification filter and interpreter
     * @param time                 clock source
     * @param subscriptionDuration lifetime requested on subscribe and renew
     * @param renewMargin          how long before expiry to renew
     * @param pullLimit            maximum notifications per pull
     */
    public SubscriptionClient(DeviceConfig device,
            EventSubscriptionTransport transport,
            NotificationParser parser,
            TimeSource time,
            Duration subscriptionDuration,
            Duration renewMargin,
            int pullLimit) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.time = Objects.requireNonNull(time, "time must not be null");
        this.subscriptionDuration = Objects.requireNonNull(subscriptionDuration,
                "subscriptionDuration must not be null");
        this.renewMargin = Objects.requireNonNull(renewMargin, "renewMargin must not be null");
        if (pullLimit < 1) {
            throw new IllegalArgumentException("pullLimit must be >= 1, got: " + pullLimit);
        }
        this.pullLimit = pullLimit;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Create the subscription. Any previous subscription is released first.
     *
     * @throws DeviceConnectException on network or authentication failure
     */
    public void connect() throws DeviceConnectException {
        close();
        LOG.info("Subscribing to events on {}:{}", device.getHost(), device.getOnvifPort());
        SubscriptionLease lease;
        try {
            lease = transport.subscribe(device, subscriptionDuration);
        } catch (IOException e) {
            throw new DeviceConnectException(device.getName(),
                    "Failed to subscribe to events on " + device.getHost() + ": " + e.getMessage(), e);
        }
        subscription = new Subscription(device.getName(), lease.getEndpointReference(), renewBefore(lease));
        LOG.info("Event subscription active at {} (valid for {})",
                lease.getEndpointReference(), lease.getValidFor());
    }

    /**
     * Wait for the next presence notification.
     *
     * <p>
     * Blocks until a person-topic notification arrives or {@code timeout}
     * elapses. Renewals happen transparently inside the wait. Malformed and
     * unrelated notifications are discarded.
     * </p>
     *
     * @param timeout maximum time to wait
     * @return the next event, or empty if none arrived in time
     * @throws DeviceConnectException if renewing or receiving failed; the
     *                                subscription is closed in that case
     * @throws IllegalStateException  if not connected
     */
    public Optional<DetectionEvent> nextEvent(Duration timeout) throws DeviceConnectException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (subscription == null) {
            throw new IllegalStateException("Subscription client for '" + device.getName() + "' is not connected");
        }
        long deadline = time.nanoTime() + timeout.toNanos();

        while (true) {
            Optional<DetectionEvent> buffered = drainPending();
            if (buffered.isPresent()) {
                return buffered;
            }

            long now = time.nanoTime();
            if (now - subscription.getRenewBeforeNanos() >= 0) {
                renew();
                now = time.nanoTime();
            }

            long remaining = deadline - now;
            if (remaining <= 0) {
                return Optional.empty();
            }
            long untilRenewal = Math.max(0, subscription.getRenewBeforeNanos() - now);
            Duration wait = Duration.ofNanos(Math.min(remaining, untilRenewal));

            List<RawNotification> received;
            try {
                received = transport.pull(device, subscription.getEndpointReference(), wait, pullLimit);
            } catch (IOException e) {
                close();
                throw new DeviceConnectException(device.getName(),
                        "Failed to receive events from " + device.getHost() + ": " + e.getMessage(), e);
            }
            pending.addAll(received);
        }
    }

    /** @return {@code true} while a subscription is held */
    public boolean isConnected() {
        return subscription != null;
    }

    /**
     * @return the current subscription, if connected
     */
    public Optional<Subscription> currentSubscription() {
        return Optional.ofNullable(subscription);
    }

    /**
     * Release the subscription. Idempotent and never throws; failures to
     * unsubscribe are logged because the device expires the subscription on
     * its own anyway.
     */
    @Override
    public void close() {
        pending.clear();
        Subscription current = subscription;
        subscription = null;
        if (current == null) {
            return;
        }
        try {
            transport.unsubscribe(device, current.getEndpointReference());
            LOG.info("Event subscription released");
        } catch (IOException | RuntimeException e) {
            LOG.debug("Unsubscribe from {} failed, device will expire it: {}",
                    current.getEndpointReference(), e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Optional<DetectionEvent> drainPending() {
        while (!pending.isEmpty()) {
            RawNotification notification = pending.pollFirst();
            try {
                Optional<DetectionEvent> event = parser.parse(
                        device.getName(), notification, time.nanoTime(), time.now());
                if (event.isPresent()) {
                    return event;
                }
                LOG.trace("Ignoring notification on topic {}", notification.getTopic());
            } catch (NotificationFormatException e) {
                LOG.debug("Discarding malformed notification: {}", e.getMessage());
            }
        }
        return Optional.empty();
    }

    private void renew() throws DeviceConnectException {
        SubscriptionLease lease;
        try {
            lease = transport.renew(device, subscription.getEndpointReference(), subscriptionDuration);
        } catch (IOException e) {
            close();
            throw new DeviceConnectException(device.getName(),
                    "Failed to renew event subscription on " + device.getHost() + ": " + e.getMessage(), e);
        }
        subscription = subscription.withRenewBefore(renewBefore(lease));
        LOG.debug("Event subscription renewed for {}", lease.getValidFor());
    }

    private long renewBefore(SubscriptionLease lease) {
        Duration validFor = lease.getValidFor();
        Duration lead = validFor.compareTo(renewMargin) > 0
                ? validFor.minus(renewMargin)
                : validFor.dividedBy(2);
        return time.nanoTime() + lead.toNanos();
    }
}
