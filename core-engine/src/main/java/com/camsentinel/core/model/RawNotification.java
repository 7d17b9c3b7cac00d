package com.camsentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A notification exactly as a transport received it, before any filtering.
 *
 * <p>
 * {@code data} holds the message's simple items (name to value). The topic
 * and items are free-form; deciding whether the notification is a presence
 * change is the job of the subscription layer.
 * </p>
 *
 * @since 1.0.0
 */
public final class RawNotification {

    private final String topic;
    private final Map<String, String> data;
    private final Instant utcTime;

    public RawNotification(String topic, Map<String, String> data, Instant utcTime) {
        this.topic = topic;
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        this.utcTime = utcTime;
    }

    /** @return the topic expression, may be {@code null} for malformed messages */
    public String getTopic() {
        return topic;
    }

    /** @return unmodifiable view of the simple items */
    public Map<String, String> getData() {
        return Collections.unmodifiableMap(data);
    }

    /** @return the device timestamp, if the message carried one */
    public Optional<Instant> getUtcTime() {
        return Optional.ofNullable(utcTime);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawNotification that))
            return false;
        return Objects.equals(topic, that.topic)
                && data.equals(that.data)
                && Objects.equals(utcTime, that.utcTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, data, utcTime);
    }

    @Override
    public String toString() {
        return "RawNotification{topic='" + topic + "', data=" + data + ", utcTime=" + utcTime + '}';
    }
}
