package com.camsentinel.service.onvif;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.model.RawNotification;
import com.camsentinel.core.subscription.SubscriptionLease;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link OnvifPullPointTransport} against an in-process fake camera.
 */
class OnvifPullPointTransportTest {

    private HttpServer camera;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> paths = new CopyOnWriteArrayList<>();
    private volatile int forcedStatus;
    private volatile String forcedBody;

    private OnvifPullPointTransport transport;
    private DeviceConfig device;

    @BeforeEach
    void startCamera() throws IOException {
        camera = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        camera.createContext("/", this::answer);
        camera.start();
        device = DeviceConfig.builder()
                .name("front-door")
                .host("127.0.0.1")
                .onvifPort(camera.getAddress().getPort())
                .username("admin")
                .password("secret")
                .build();
        transport = new OnvifPullPointTransport(HttpClient.newHttpClient(), Duration.ofSeconds(5),
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void stopCamera() {
        camera.stop(0);
    }

    private void answer(HttpExchange exchange) throws IOException {
        String request = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(request);
        paths.add(exchange.getRequestURI().toString());

        int status = 200;
        String body;
        if (forcedStatus != 0) {
            status = forcedStatus;
            body = forcedBody == null ? "" : forcedBody;
        } else if (request.contains("CreatePullPointSubscription>")) {
            body = Fixtures.load("create-pull-point-response.xml")
                    .replace("http://192.168.1.20:8000", "http://127.0.0.1:" + camera.getAddress().getPort());
        } else if (request.contains("PullMessages>")) {
            body = Fixtures.load("pull-messages-response.xml");
        } else if (request.contains("Renew>")) {
            body = Fixtures.load("renew-response.xml");
        } else {
            body = "<e:Envelope xmlns:e=\"http://www.w3.org/2003/05/soap-envelope\"><e:Body>"
                    + "<UnsubscribeResponse/></e:Body></e:Envelope>";
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/soap+xml; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
        exchange.close();
    }

    @Test
    @DisplayName("Should subscribe, pull, renew and unsubscribe against the subscription address")
    void shouldRunFullExchange() throws IOException {
        SubscriptionLease lease = transport.subscribe(device, Duration.ofSeconds(60));
        List<RawNotification> pulled = transport.pull(device, lease.getEndpointReference(), Duration.ofSeconds(1), 10);
        SubscriptionLease renewed = transport.renew(device, lease.getEndpointReference(), Duration.ofSeconds(60));
        transport.unsubscribe(device, lease.getEndpointReference());

        assertThat(lease.getValidFor()).isEqualTo(Duration.ofSeconds(60));
        assertThat(pulled).extracting(RawNotification::getTopic)
                .containsExactly("tns1:RuleEngine/MyRuleDetector/PeopleDetect",
                        "tns1:RuleEngine/CellMotionDetector/Motion");
        assertThat(renewed.getEndpointReference()).isEqualTo(lease.getEndpointReference());
        assertThat(renewed.getValidFor()).isEqualTo(Duration.ofSeconds(30));

        assertThat(paths).containsExactly("/onvif/event_service", "/onvif/Subscription?Idx=3",
                "/onvif/Subscription?Idx=3", "/onvif/Subscription?Idx=3");
    }

    @Test
    @DisplayName("Should send WS-Addressing headers and a digest token")
    void shouldSendSignedEnvelope() throws IOException {
        transport.subscribe(device, Duration.ofSeconds(60));

        String request = requests.get(0);
        assertThat(request)
                .contains(SoapEnvelope.CREATE_PULL_POINT_ACTION)
                .contains("<a:To s:mustUnderstand=\"1\">http://127.0.0.1:")
                .contains("<tev:InitialTerminationTime>PT1M</tev:InitialTerminationTime>")
                .contains("<wsse:Username>admin</wsse:Username>")
                .contains("<wsu:Created>2024-05-01T10:00:00Z</wsu:Created>")
                .doesNotContain("secret");
    }

    @Test
    @DisplayName("Should ask for the requested long-poll timeout and message limit")
    void shouldSendPullParameters() throws IOException {
        transport.pull(device, OnvifPullPointTransport.eventServiceUrl(device), Duration.ofMillis(1500), 7);

        assertThat(requests.get(0))
                .contains("<tev:Timeout>PT1.5S</tev:Timeout>")
                .contains("<tev:MessageLimit>7</tev:MessageLimit>");
    }

    @Test
    @DisplayName("Should report rejected credentials")
    void shouldReportAuthenticationFailure() {
        forcedStatus = 401;

        assertThatThrownBy(() -> transport.subscribe(device, Duration.ofSeconds(60)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Authentication rejected");
    }

    @Test
    @DisplayName("Should surface SOAP faults as I/O failures")
    void shouldReportSoapFault() {
        forcedStatus = 400;
        forcedBody = Fixtures.load("not-authorized-fault.xml");

        assertThatThrownBy(() -> transport.subscribe(device, Duration.ofSeconds(60)))
                .isInstanceOf(SoapFaultException.class)
                .hasMessageContaining("ter:NotAuthorized");
    }

    @Test
    @DisplayName("Should report server errors without a SOAP body")
    void shouldReportServerError() {
        forcedStatus = 500;
        forcedBody = "Internal Server Error";

        assertThatThrownBy(() -> transport.subscribe(device, Duration.ofSeconds(60)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    @DisplayName("Should report an unreachable device")
    void shouldReportUnreachableDevice() {
        camera.stop(0);

        assertThatThrownBy(() -> transport.subscribe(device, Duration.ofSeconds(60)))
                .isInstanceOf(IOException.class);
    }
}
