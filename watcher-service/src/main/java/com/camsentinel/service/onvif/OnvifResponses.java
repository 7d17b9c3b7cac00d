package com.camsentinel.service.onvif;

import com.camsentinel.core.model.RawNotification;
import com.camsentinel.core.subscription.SubscriptionLease;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import javax.xml.stream.XMLInputFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads ONVIF event service responses.
 *
 * <p>
 * Responses are read into a Jackson tree. {@link XmlMapper} keys elements
 * and attributes by local name, so devices that disagree on prefixes read
 * the same. A repeated element becomes an array and a single one an object;
 * both shapes are accepted wherever a list is expected. The text of an
 * element that also carries attributes sits under the empty key.
 * </p>
 *
 * <p>
 * Documents declaring a DTD are refused, and the reader never processes one.
 * </p>
 */
final class OnvifResponses {

    private static final XmlMapper XML_MAPPER = createMapper();

    private OnvifResponses() {
    }

    private static XmlMapper createMapper() {
        XMLInputFactory input = XMLInputFactory.newInstance();
        input.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        input.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        XmlMapper mapper = new XmlMapper(XmlFactory.builder().xmlInputFactory(input).build());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // ---------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------

    /**
     * @param xml response body
     * @return the envelope's tree, keyed by local names
     * @throws IOException if the body is not well-formed XML or declares a DTD
     */
    static JsonNode parse(String xml) throws IOException {
        if (xml.contains("<!DOCTYPE")) {
            throw new IOException("SOAP response must not declare a DTD");
        }
        try {
            JsonNode envelope = XML_MAPPER.readTree(xml.getBytes(StandardCharsets.UTF_8));
            if (envelope == null || !envelope.isObject()) {
                throw new IOException("SOAP response is not an envelope");
            }
            return envelope;
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed SOAP response: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param envelope a parsed response
     * @return the fault reason if the response is a SOAP fault
     */
    static Optional<String> faultReason(JsonNode envelope) {
        JsonNode fault = envelope.path("Body").path("Fault");
        if (fault.isMissingNode()) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>();
        String subcode = text(fault.path("Code").path("Subcode").path("Value"));
        if (!subcode.isEmpty()) {
            parts.add(subcode);
        }
        String reason = text(first(fault.path("Reason").path("Text")));
        if (reason.isEmpty()) {
            reason = text(fault.path("faultstring"));
        }
        if (!reason.isEmpty()) {
            parts.add(reason);
        }
        return Optional.of(parts.isEmpty() ? "unspecified" : String.join(": ", parts));
    }

    // ---------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------

    /**
     * Read a {@code CreatePullPointSubscriptionResponse}.
     *
     * @param envelope  the response
     * @param requested lifetime that was asked for, used when the device
     *                  omits or garbles its times
     * @return the lease
     * @throws IOException if the response carries no subscription address
     */
    static SubscriptionLease subscription(JsonNode envelope, Duration requested) throws IOException {
        String address = text(response(envelope).path("SubscriptionReference").path("Address"));
        if (address.isEmpty()) {
            throw new IOException("CreatePullPointSubscription response carries no subscription address");
        }
        return new SubscriptionLease(address, validity(envelope, requested));
    }

    /**
     * Lifetime granted by a subscribe or renew response: {@code TerminationTime}
     * minus {@code CurrentTime}, both in the device's clock.
     *
     * @param envelope  the response
     * @param requested fallback when the times are missing or inconsistent
     * @return the granted lifetime
     */
    static Duration validity(JsonNode envelope, Duration requested) {
        JsonNode response = response(envelope);
        Instant current = parseTime(text(response.path("CurrentTime")));
        Instant termination = parseTime(text(response.path("TerminationTime")));
        if (current == null || termination == null || !termination.isAfter(current)) {
            return requested;
        }
        return Duration.between(current, termination);
    }

    // ---------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------

    /**
     * Read the notifications of a {@code PullMessagesResponse}.
     *
     * @param envelope the response
     * @return notifications in document order, possibly empty
     */
    static List<RawNotification> notifications(JsonNode envelope) {
        List<RawNotification> result = new ArrayList<>();
        for (JsonNode message : elements(response(envelope).path("NotificationMessage"))) {
            JsonNode payload = payload(message);

            Map<String, String> data = new LinkedHashMap<>();
            for (JsonNode item : elements(payload.path("Data").path("SimpleItem"))) {
                data.put(item.path("Name").asText(), item.path("Value").asText());
            }
            Instant utcTime = parseTime(payload.path("UtcTime").asText(null));
            result.add(new RawNotification(text(message.path("Topic")), data, utcTime));
        }
        return result;
    }

    /** The inner {@code tt:Message} carrying the UtcTime attribute. */
    private static JsonNode payload(JsonNode notificationMessage) {
        JsonNode wrapper = notificationMessage.path("Message");
        JsonNode inner = wrapper.path("Message");
        return inner.isObject() ? inner : wrapper;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** The single response element inside {@code Body}. */
    private static JsonNode response(JsonNode envelope) {
        JsonNode body = envelope.path("Body");
        Iterator<JsonNode> children = body.elements();
        while (children.hasNext()) {
            JsonNode child = children.next();
            if (child.isObject()) {
                return child;
            }
        }
        return body;
    }

    private static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> result = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(result::add);
        } else if (node.isObject()) {
            result.add(node);
        }
        return result;
    }

    private static JsonNode first(JsonNode node) {
        return node.isArray() ? node.path(0) : node;
    }

    /** Text of an element, whether it was read as a plain value or alongside attributes. */
    private static String text(JsonNode node) {
        if (node.isValueNode()) {
            return node.asText().trim();
        }
        if (node.isObject() && node.has("")) {
            return node.get("").asText().trim();
        }
        return "";
    }

    /**
     * Devices send xs:dateTime with {@code Z}, with an offset, or without any
     * zone; the latter is taken as UTC.
     *
     * @return the instant, or {@code null} if the text is blank or unreadable
     */
    static Instant parseTime(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException unzoned) {
                return null;
            }
        }
    }
}
