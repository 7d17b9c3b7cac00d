package com.camsentinel.service;

import com.camsentinel.core.pipeline.PipelineState;
import com.camsentinel.core.pipeline.PipelineStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HealthServer} over real HTTP.
 */
class HealthServerTest {

    private final AtomicReference<List<PipelineStatus>> statuses = new AtomicReference<>(List.of());
    private final HealthServer server = new HealthServer(statuses::get,
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    private final HttpClient client = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(
                URI.create("http://127.0.0.1:" + server.getPort() + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static PipelineStatus status(String name, PipelineState state, String session) {
        return new PipelineStatus(name, state, session, 3, 0, 1, 0, null);
    }

    @Test
    @DisplayName("Should report per-device status as JSON")
    void shouldReportDevices() throws Exception {
        statuses.set(List.of(
                status("front-door", PipelineState.WATCHING, "front-door/person_detection_20240501_100000_000"),
                status("garage", PipelineState.RECONNECTING, null)));
        server.start(0);

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
        JsonNode json = mapper.readTree(response.body());
        assertThat(json.get("status").asText()).isEqualTo("UP");
        assertThat(json.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("devices").size()).isEqualTo(2);
        assertThat(json.get("devices").get(0).get("deviceName").asText()).isEqualTo("front-door");
        assertThat(json.get("devices").get(0).get("recording").asBoolean()).isTrue();
        assertThat(json.get("devices").get(1).get("state").asText()).isEqualTo("RECONNECTING");
    }

    @Test
    @DisplayName("Should answer 503 once every pipeline has failed")
    void shouldReportDownWhenAllFailed() throws Exception {
        statuses.set(List.of(status("a", PipelineState.FAILED, null), status("b", PipelineState.FAILED, null)));
        server.start(0);

        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(mapper.readTree(response.body()).get("status").asText()).isEqualTo("DOWN");
    }

    @Test
    @DisplayName("Should stay up while at least one pipeline is alive")
    void shouldStayUpWithOneSurvivor() {
        statuses.set(List.of(status("a", PipelineState.FAILED, null), status("b", PipelineState.WATCHING, null)));

        assertThat(server.healthReport()).containsEntry("status", "UP");
    }

    @Test
    @DisplayName("Readiness should answer UP")
    void shouldAnswerReadiness() throws Exception {
        server.start(0);

        HttpResponse<String> response = get("/readiness");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
    }

    @Test
    @DisplayName("Should report running state and stop idempotently")
    void shouldStopIdempotently() {
        server.start(0);
        assertThat(server.isRunning()).isTrue();

        server.stop();
        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectBadPort() {
        assertThatThrownBy(() -> server.start(70_000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
