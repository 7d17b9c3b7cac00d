package com.camsentinel.service.capture;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.recording.SnapshotFetcher;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Fetches a JPEG still through the camera's HTTP API
 * ({@code /cgi-bin/api.cgi?cmd=Snap}).
 *
 * <p>
 * The API answers errors with a JSON body and status 200, so anything that
 * is not an image is treated as a failure.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpSnapshotFetcher implements SnapshotFetcher {

    private final HttpClient http;
    private final Duration timeout;

    public HttpSnapshotFetcher(HttpClient http, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public byte[] fetch(DeviceConfig device) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(snapshotUrl(device)))
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<byte[]> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching snapshot from " + device.getHost());
        }
        return check(response.statusCode(), response.headers().firstValue("Content-Type").orElse(""),
                response.body(), device);
    }

    /**
     * @param device the camera
     * @return snapshot URL with a random cache-busting token and encoded credentials
     */
    static String snapshotUrl(DeviceConfig device) {
        return "http://" + device.getHost() + ":" + device.getPort() + "/cgi-bin/api.cgi?cmd=Snap"
                + "&channel=" + device.getChannel()
                + "&rs=" + UUID.randomUUID().toString().replace("-", "").substring(0, 16)
                + "&user=" + encode(device.getUsername())
                + "&password=" + encode(device.getPassword());
    }

    static byte[] check(int status, String contentType, byte[] body, DeviceConfig device) throws IOException {
        if (status != 200) {
            throw new IOException("Snapshot request to " + device.getHost() + " failed with HTTP " + status);
        }
        if (!contentType.startsWith("image/")) {
            String snippet = new String(body, 0, Math.min(body.length, 200), StandardCharsets.UTF_8);
            throw new IOException("Snapshot endpoint of " + device.getHost() + " returned " + contentType
                    + " instead of an image: " + snippet);
        }
        if (body.length == 0) {
            throw new IOException("Snapshot from " + device.getHost() + " is empty");
        }
        return body;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
