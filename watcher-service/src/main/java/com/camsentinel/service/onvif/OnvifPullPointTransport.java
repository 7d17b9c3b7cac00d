package com.camsentinel.service.onvif;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.model.RawNotification;
import com.camsentinel.core.subscription.EventSubscriptionTransport;
import com.camsentinel.core.subscription.SubscriptionLease;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EventSubscriptionTransport} speaking the ONVIF PullPoint protocol.
 *
 * <h3>Exchange</h3>
 *
 * <pre>
 *   CreatePullPointSubscription → http://host:onvifPort/onvif/event_service
 *   PullMessages / Renew / Unsubscribe → subscription address from the response
 * </pre>
 *
 * <p>
 * Requests are SOAP 1.2 over HTTP, authenticated with a WS-Security
 * UsernameToken digest. HTTP 401/403, SOAP faults, other non-2xx statuses
 * and unreadable responses all surface as {@link IOException}.
 * </p>
 *
 * <p>
 * Stateless apart from the shared {@link HttpClient}; safe for concurrent use
 * by several device pipelines.
 * </p>
 *
 * @since 1.0.0
 */
public class OnvifPullPointTransport implements EventSubscriptionTransport {

    private static final Logger LOG = LoggerFactory.getLogger(OnvifPullPointTransport.class);

    static final String EVENT_SERVICE_PATH = "/onvif/event_service";

    private final HttpClient http;
    private final Duration requestTimeout;
    private final Clock clock;

    /**
     * @param http           shared HTTP client
     * @param requestTimeout timeout for each request; pulls add their own
     *                       long-poll wait on top
     */
    public OnvifPullPointTransport(HttpClient http, Duration requestTimeout) {
        this(http, requestTimeout, Clock.systemUTC());
    }

    OnvifPullPointTransport(HttpClient http, Duration requestTimeout, Clock clock) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // EventSubscriptionTransport
    // ---------------------------------------------------------------

    @Override
    public SubscriptionLease subscribe(DeviceConfig device, Duration validFor) throws IOException {
        JsonNode response = call(device, eventServiceUrl(device), SoapEnvelope.CREATE_PULL_POINT_ACTION,
                SoapEnvelope.createPullPointSubscription(validFor), requestTimeout);
        return OnvifResponses.subscription(response, validFor);
    }

    @Override
    public SubscriptionLease renew(DeviceConfig device, String endpointReference, Duration validFor)
            throws IOException {
        JsonNode response = call(device, endpointReference, SoapEnvelope.RENEW_ACTION,
                SoapEnvelope.renew(validFor), requestTimeout);
        return new SubscriptionLease(endpointReference, OnvifResponses.validity(response, validFor));
    }

    @Override
    public List<RawNotification> pull(DeviceConfig device, String endpointReference, Duration timeout, int limit)
            throws IOException {
        JsonNode response = call(device, endpointReference, SoapEnvelope.PULL_MESSAGES_ACTION,
                SoapEnvelope.pullMessages(timeout, limit), timeout.plus(requestTimeout));
        List<RawNotification> notifications = OnvifResponses.notifications(response);
        if (!notifications.isEmpty()) {
            LOG.debug("Pulled {} notification(s) from {}", notifications.size(), device.getHost());
        }
        return notifications;
    }

    @Override
    public void unsubscribe(DeviceConfig device, String endpointReference) throws IOException {
        call(device, endpointReference, SoapEnvelope.UNSUBSCRIBE_ACTION, SoapEnvelope.unsubscribe(),
                requestTimeout);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static String eventServiceUrl(DeviceConfig device) {
        return "http://" + device.getHost() + ":" + device.getOnvifPort() + EVENT_SERVICE_PATH;
    }

    private JsonNode call(DeviceConfig device, String url, String action, String body, Duration timeout)
            throws IOException {
        String envelope = SoapEnvelope.wrap(action, url, device.getUsername(), device.getPassword(),
                clock.instant(), body);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/soap+xml; charset=utf-8; action=\"" + action + "\"")
                    .POST(HttpRequest.BodyPublishers.ofString(envelope, StandardCharsets.UTF_8))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid endpoint address '" + url + "': " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while calling " + url);
        }
        return interpret(response.statusCode(), response.body(), url);
    }

    /**
     * Turn a raw HTTP answer into a parsed envelope or the matching failure.
     */
    static JsonNode interpret(int status, String body, String url) throws IOException {
        if (status == 401 || status == 403) {
            throw new IOException("Authentication rejected by " + url + " (HTTP " + status + ")");
        }
        boolean ok = status / 100 == 2;
        if (body == null || body.isBlank()) {
            if (ok) {
                throw new IOException("Empty response from " + url);
            }
            throw new IOException("HTTP " + status + " from " + url);
        }
        if (!ok && !body.contains("Fault")) {
            throw new IOException("HTTP " + status + " from " + url);
        }
        JsonNode envelope = OnvifResponses.parse(body);
        Optional<String> fault = OnvifResponses.faultReason(envelope);
        if (fault.isPresent()) {
            throw new SoapFaultException(fault.get());
        }
        if (!ok) {
            throw new IOException("HTTP " + status + " from " + url);
        }
        return envelope;
    }
}
