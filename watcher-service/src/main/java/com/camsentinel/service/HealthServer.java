package com.camsentinel.service;

import com.camsentinel.core.pipeline.PipelineState;
import com.camsentinel.core.pipeline.PipelineStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with per-device pipeline status as
 * JSON; {@code 503} once every device pipeline has failed</li>
 * <li>{@code GET /readiness}: {@code 200 OK} with {@code {"status":"UP"}}
 * while the server runs</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no servlet container is
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final Supplier<List<PipelineStatus>> statuses;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param statuses source of the current per-device status
     */
    public HealthServer(Supplier<List<PipelineStatus>> statuses) {
        this(statuses, Clock.systemUTC());
    }

    HealthServer(Supplier<List<PipelineStatus>> statuses, Clock clock) {
        this.statuses = Objects.requireNonNull(statuses, "statuses must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealth);
            server.createContext("/readiness", this::handleReadiness);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not running
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    /**
     * @return the health document; {@code status} is {@code DOWN} once every pipeline failed
     */
    Map<String, Object> healthReport() {
        List<PipelineStatus> current = statuses.get();
        boolean down = !current.isEmpty()
                && current.stream().allMatch(s -> s.getState() == PipelineState.FAILED);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("status", down ? "DOWN" : "UP");
        report.put("timestamp", clock.instant());
        report.put("devices", current);
        return report;
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        Map<String, Object> report = healthReport();
        int status = "UP".equals(report.get("status")) ? 200 : 503;
        respond(exchange, status, report);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        respond(exchange, 200, Map.of("status", "UP"));
    }

    private void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize health response: {}", e.getMessage(), e);
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
            return;
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
