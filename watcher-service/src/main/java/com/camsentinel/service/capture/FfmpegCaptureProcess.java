package com.camsentinel.service.capture;

import com.camsentinel.core.recording.CaptureProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * A running {@code ffmpeg} recorder.
 *
 * <p>
 * Stderr is drained continuously by a daemon thread, so a chatty recorder
 * never blocks on a full pipe; the last {@value #TAIL_LINES} lines are kept
 * for diagnostics. A graceful stop writes {@code q} to stdin, which makes
 * ffmpeg finish the MP4 container before exiting.
 * </p>
 */
class FfmpegCaptureProcess implements CaptureProcess {

    private static final Logger LOG = LoggerFactory.getLogger(FfmpegCaptureProcess.class);

    static final int TAIL_LINES = 15;

    private final Process process;
    private final Deque<String> tail = new ArrayDeque<>();

    FfmpegCaptureProcess(Process process, String deviceName) {
        this.process = Objects.requireNonNull(process, "process must not be null");
        Thread drainer = new Thread(this::drainStderr, "ffmpeg-stderr-" + deviceName);
        drainer.setDaemon(true);
        drainer.start();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public void requestGracefulStop() throws IOException {
        if (!process.isAlive()) {
            return;
        }
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write('q');
            stdin.flush();
        }
    }

    @Override
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public void terminate() {
        process.destroy();
    }

    @Override
    public void kill() {
        process.destroyForcibly();
    }

    @Override
    public OptionalInt exitCode() {
        return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
    }

    @Override
    public String diagnosticTail() {
        synchronized (tail) {
            return String.join("\n", tail);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                remember(line);
            }
        } catch (IOException e) {
            LOG.debug("Recorder stderr closed: {}", e.getMessage());
        }
    }

    void remember(String line) {
        synchronized (tail) {
            if (tail.size() == TAIL_LINES) {
                tail.removeFirst();
            }
            tail.addLast(line);
        }
    }
}
