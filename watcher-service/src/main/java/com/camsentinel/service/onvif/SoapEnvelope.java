package com.camsentinel.service.onvif;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * SOAP 1.2 request envelopes for the ONVIF event service.
 *
 * <p>
 * Every request carries WS-Addressing {@code Action}, {@code MessageID} and
 * {@code To} headers plus a {@link WsSecurity} UsernameToken.
 * </p>
 */
final class SoapEnvelope {

    static final String SOAP_NS = "http://www.w3.org/2003/05/soap-envelope";
    static final String ADDRESSING_NS = "http://www.w3.org/2005/08/addressing";
    static final String EVENTS_NS = "http://www.onvif.org/ver10/events/wsdl";
    static final String NOTIFICATION_NS = "http://docs.oasis-open.org/wsn/b-2";

    // ---------------------------------------------------------------
    // Actions
    // ---------------------------------------------------------------
    static final String CREATE_PULL_POINT_ACTION =
            EVENTS_NS + "/EventPortType/CreatePullPointSubscriptionRequest";
    static final String PULL_MESSAGES_ACTION =
            EVENTS_NS + "/PullPointSubscription/PullMessagesRequest";
    static final String RENEW_ACTION =
            "http://docs.oasis-open.org/wsn/bw-2/SubscriptionManager/RenewRequest";
    static final String UNSUBSCRIBE_ACTION =
            "http://docs.oasis-open.org/wsn/bw-2/SubscriptionManager/UnsubscribeRequest";

    private SoapEnvelope() {
    }

    // ---------------------------------------------------------------
    // Bodies
    // ---------------------------------------------------------------

    static String createPullPointSubscription(Duration validFor) {
        return "<tev:CreatePullPointSubscription>"
                + "<tev:InitialTerminationTime>" + validFor + "</tev:InitialTerminationTime>"
                + "</tev:CreatePullPointSubscription>";
    }

    static String pullMessages(Duration timeout, int limit) {
        return "<tev:PullMessages>"
                + "<tev:Timeout>" + timeout + "</tev:Timeout>"
                + "<tev:MessageLimit>" + limit + "</tev:MessageLimit>"
                + "</tev:PullMessages>";
    }

    static String renew(Duration validFor) {
        return "<wsnt:Renew><wsnt:TerminationTime>" + validFor + "</wsnt:TerminationTime></wsnt:Renew>";
    }

    static String unsubscribe() {
        return "<wsnt:Unsubscribe/>";
    }

    // ---------------------------------------------------------------
    // Envelope
    // ---------------------------------------------------------------

    /**
     * Wrap a body into a complete, signed envelope.
     *
     * @param action   WS-Addressing action URI
     * @param to       endpoint the request is posted to
     * @param username device user
     * @param password device password
     * @param now      time used for the security token
     * @param body     body content
     * @return the serialized envelope
     */
    static String wrap(String action, String to, String username, String password, Instant now, String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<s:Envelope xmlns:s=\"" + SOAP_NS + "\" xmlns:a=\"" + ADDRESSING_NS + "\""
                + " xmlns:tev=\"" + EVENTS_NS + "\" xmlns:wsnt=\"" + NOTIFICATION_NS + "\">"
                + "<s:Header>"
                + "<a:Action s:mustUnderstand=\"1\">" + action + "</a:Action>"
                + "<a:MessageID>urn:uuid:" + UUID.randomUUID() + "</a:MessageID>"
                + "<a:To s:mustUnderstand=\"1\">" + escape(to) + "</a:To>"
                + WsSecurity.securityHeader(username, password, now)
                + "</s:Header>"
                + "<s:Body>" + body + "</s:Body>"
                + "</s:Envelope>";
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
