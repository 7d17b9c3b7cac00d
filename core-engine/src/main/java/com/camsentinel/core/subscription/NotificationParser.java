package com.camsentinel.core.subscription;

import com.camsentinel.core.model.DetectionEvent;
import com.camsentinel.core.model.RawNotification;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns {@link RawNotification}s into {@link DetectionEvent}s.
 *
 * <p>
 * Only notifications whose topic ends in one of the configured person
 * topics are considered; the final topic segment is compared without its
 * namespace prefix and ignoring case, so {@code tns1:RuleEngine/MyRuleDetector/PeopleDetect}
 * matches {@code PeopleDetect}. The presence flag is read from the first of
 * {@link #PRESENCE_ITEMS} that the message carries.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 */
public class NotificationParser {

    /** Simple-item names that carry the presence flag, in lookup order. */
    static final List<String> PRESENCE_ITEMS = List.of("State", "IsPeople");

    private final Set<String> topics;

    /**
     * @param personTopics comma-separated topic names, e.g. {@code PeopleDetect,People}
     * @throws IllegalArgumentException if no topic is given
     */
    public NotificationParser(String personTopics) {
        Objects.requireNonNull(personTopics, "personTopics must not be null");
        this.topics = Arrays.stream(personTopics.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        if (topics.isEmpty()) {
            throw new IllegalArgumentException("At least one person topic is required");
        }
    }

    /**
     * Interpret one notification.
     *
     * @param deviceName     device the notification came from
     * @param notification   the raw notification
     * @param receivedNanos  monotonic receipt time
     * @param receivedAt     wall-clock receipt time, used when the device sent no timestamp
     * @return the detection event, or empty if the topic is not a person topic
     * @throws NotificationFormatException if the topic matches but the payload
     *                                     cannot be interpreted
     */
    public Optional<DetectionEvent> parse(String deviceName, RawNotification notification,
            long receivedNanos, Instant receivedAt) throws NotificationFormatException {
        Objects.requireNonNull(notification, "notification must not be null");

        String topic = notification.getTopic();
        if (topic == null || topic.isBlank()) {
            throw new NotificationFormatException("Notification without topic: " + notification);
        }
        if (!topics.contains(lastSegment(topic))) {
            return Optional.empty();
        }

        String raw = null;
        for (String item : PRESENCE_ITEMS) {
            raw = notification.getData().get(item);
            if (raw != null) {
                break;
            }
        }
        if (raw == null) {
            throw new NotificationFormatException(
                    "Person notification carries none of " + PRESENCE_ITEMS + ": " + notification);
        }

        boolean present = parseFlag(raw.trim(), notification);
        Instant observedAt = notification.getUtcTime().orElse(receivedAt);
        return Optional.of(new DetectionEvent(deviceName, receivedNanos, observedAt, present));
    }

    private static String lastSegment(String topic) {
        String segment = topic.trim();
        int slash = segment.lastIndexOf('/');
        if (slash >= 0) {
            segment = segment.substring(slash + 1);
        }
        int colon = segment.lastIndexOf(':');
        if (colon >= 0) {
            segment = segment.substring(colon + 1);
        }
        return segment.toLowerCase(Locale.ROOT);
    }

    private static boolean parseFlag(String value, RawNotification notification)
            throws NotificationFormatException {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1" -> true;
            case "false", "0" -> false;
            default -> throw new NotificationFormatException(
                    "Unrecognised presence value '" + value + "': " + notification);
        };
    }
}
