package com.camsentinel.core.pipeline;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.support.FakeCaptureLauncher;
import com.camsentinel.core.support.FakeSnapshotFetcher;
import com.camsentinel.core.support.ManualTimeSource;
import com.camsentinel.core.support.Notifications;
import com.camsentinel.core.support.ScriptedTransport;
import com.camsentinel.core.support.TestDevices;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DevicePipeline} driven on a virtual clock.
 */
@Timeout(30)
class DevicePipelineTest {

    @TempDir
    Path root;

    private final DeviceConfig device = TestDevices.device("front-door");
    private final ManualTimeSource time = new ManualTimeSource();
    private final ScriptedTransport transport = new ScriptedTransport(time);
    private final FakeSnapshotFetcher fetcher = new FakeSnapshotFetcher();
    private final FakeCaptureLauncher launcher = new FakeCaptureLauncher();

    private PipelineSettings.Builder settings() {
        return PipelineSettings.builder()
                .postDetectionDuration(Duration.ofSeconds(15))
                .tickInterval(Duration.ofSeconds(1))
                .backoffBase(Duration.ofMillis(10))
                .backoffMax(Duration.ofMillis(20))
                .outputRoot(root);
    }

    private DevicePipeline pipeline(PipelineSettings settings) {
        return DevicePipeline.assemble(device, settings, transport, fetcher, launcher, time, ZoneOffset.UTC);
    }

    private static Duration seconds(double s) {
        return Duration.ofMillis((long) (s * 1000));
    }

    @Test
    @DisplayName("Should record one clip covering continuous presence plus the tail")
    void shouldRecordContinuousPresence() {
        DevicePipeline pipeline = pipeline(settings().build());
        List<Boolean> recording = new ArrayList<>();
        transport.at(seconds(1), Notifications.person(true))
                .at(seconds(5), Notifications.person(true))
                .at(seconds(10), Notifications.person(true))
                .at(seconds(12), Notifications.person(false))
                .onReach(seconds(24.5), () -> recording.add(pipeline.status().isRecording()))
                .onReach(seconds(25.5), () -> recording.add(pipeline.status().isRecording()))
                .onReach(seconds(40), pipeline::requestStop);

        pipeline.run();

        assertThat(recording).containsExactly(true, false);
        assertThat(launcher.launched()).hasSize(1);
        assertThat(launcher.last().calls()).containsExactly("graceful");
        assertThat(fetcher.calls()).isEqualTo(1);
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
        assertThat(pipeline.status().getSessionsStarted()).isEqualTo(1);
        assertThat(transport.unsubscribeCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should start a separate session for presence after the tail elapsed")
    void shouldStartNewSessionAfterGap() {
        DevicePipeline pipeline = pipeline(settings().build());
        transport.at(seconds(1), Notifications.person(true))
                .at(seconds(30), Notifications.person(true))
                .onReach(seconds(60), pipeline::requestStop);

        pipeline.run();

        assertThat(launcher.launched()).hasSize(2);
        assertThat(launcher.launched().get(0).clip()).isNotEqualTo(launcher.launched().get(1).clip());
        assertThat(launcher.maxLive()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should finalize an in-progress recording when stopped")
    void shouldFinalizeOnStop() {
        DevicePipeline pipeline = pipeline(settings().build());
        transport.at(seconds(1), Notifications.person(true))
                .onReach(seconds(3), pipeline::requestStop);

        pipeline.run();

        assertThat(launcher.last().calls()).containsExactly("graceful");
        assertThat(launcher.liveCount()).isZero();
        assertThat(pipeline.status().getActiveSessionId()).isNull();
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
    }

    @Test
    @DisplayName("Should still end the recording on time while the subscription is lost")
    void shouldStopOnTimeWhileReconnecting() {
        DevicePipeline pipeline = pipeline(settings().build());
        List<Boolean> recording = new ArrayList<>();
        transport.at(seconds(1), Notifications.person(true))
                .onReach(seconds(5), transport::failNextPull)
                .onReach(seconds(16.5), () -> recording.add(pipeline.status().isRecording()))
                .onReach(seconds(20), pipeline::requestStop);

        pipeline.run();

        assertThat(transport.subscribeCalls()).isEqualTo(2);
        assertThat(recording).containsExactly(false);
        assertThat(launcher.launched()).hasSize(1);
    }

    @Test
    @DisplayName("Should retry connecting with backoff until the device answers")
    void shouldRetryConnect() {
        DevicePipeline pipeline = pipeline(settings().build());
        transport.failSubscribes(2)
                .at(seconds(1), Notifications.person(true))
                .onReach(seconds(3), pipeline::requestStop);

        pipeline.run();

        assertThat(transport.subscribeCalls()).isEqualTo(3);
        assertThat(pipeline.status().getConnectFailures()).isEqualTo(2);
        assertThat(launcher.launched()).hasSize(1);
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
    }

    @Test
    @DisplayName("Should fail after the configured number of connect attempts")
    void shouldFailAfterMaxAttempts() {
        DevicePipeline pipeline = pipeline(settings().maxReconnectAttempts(3).build());
        transport.failSubscribes(100);

        assertThatThrownBy(pipeline::run)
                .isInstanceOf(PipelineFailureException.class)
                .hasMessageContaining("3 connect attempts");
        assertThat(pipeline.getState()).isEqualTo(PipelineState.FAILED);
        assertThat(pipeline.status().getConnectFailures()).isEqualTo(3);
        assertThat(pipeline.status().getLastError()).isNotBlank();
    }

    @Test
    @DisplayName("Should count receive failures toward the attempt limit")
    void shouldFailWhenEveryPullFails() {
        DevicePipeline pipeline = pipeline(settings().maxReconnectAttempts(3).build());
        transport.failPulls(100);

        assertThatThrownBy(pipeline::run)
                .isInstanceOf(PipelineFailureException.class)
                .hasMessageContaining("3 connect attempts");
        assertThat(transport.subscribeCalls()).isEqualTo(3);
        assertThat(pipeline.status().getConnectFailures()).isEqualTo(3);
        assertThat(pipeline.getState()).isEqualTo(PipelineState.FAILED);
    }

    @Test
    @DisplayName("Should back off before resubscribing after a receive failure")
    void shouldBackOffAfterReceiveFailure() throws Exception {
        DevicePipeline pipeline = pipeline(settings()
                .backoffBase(Duration.ofMillis(200))
                .backoffMax(Duration.ofMillis(200))
                .build());
        transport.failPulls(Integer.MAX_VALUE);
        Thread thread = new Thread(pipeline, "pipeline-test");
        thread.start();

        Thread.sleep(500);
        pipeline.requestStop();

        assertThat(pipeline.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(transport.subscribeCalls()).isBetween(1, 4);
        assertThat(pipeline.status().getConnectFailures()).isEqualTo(transport.subscribeCalls());
        thread.join(1000);
    }

    @Test
    @DisplayName("Should reset the attempt count once a pull succeeds")
    void shouldResetAttemptsAfterSuccessfulPull() {
        DevicePipeline pipeline = pipeline(settings().maxReconnectAttempts(3).build());
        transport.failPulls(2)
                .at(seconds(1), Notifications.person(true))
                .onReach(seconds(2), () -> transport.failPulls(2))
                .onReach(seconds(5), pipeline::requestStop);

        pipeline.run();

        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
        assertThat(pipeline.status().getConnectFailures()).isEqualTo(4);
        assertThat(transport.subscribeCalls()).isEqualTo(5);
        assertThat(launcher.launched()).hasSize(1);
    }

    @Test
    @DisplayName("Should retry a failed session start on the next detection")
    void shouldRetryAfterLaunchFailure() {
        DevicePipeline pipeline = pipeline(settings().build());
        launcher.failLaunches(1);
        transport.at(seconds(1), Notifications.person(true))
                .at(seconds(3), Notifications.person(true))
                .onReach(seconds(5), pipeline::requestStop);

        pipeline.run();

        assertThat(launcher.launched()).hasSize(1);
        assertThat(pipeline.status().getSessionsStarted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should start a fresh session after the recorder died")
    void shouldRecoverFromProcessFault() {
        DevicePipeline pipeline = pipeline(settings().build());
        transport.at(seconds(1), Notifications.person(true))
                .onReach(seconds(4), () -> launcher.last().crash(1))
                .at(seconds(8), Notifications.person(true))
                .onReach(seconds(10), pipeline::requestStop);

        pipeline.run();

        assertThat(launcher.launched()).hasSize(2);
        assertThat(pipeline.status().getProcessFaults()).isEqualTo(1);
        assertThat(pipeline.status().getSessionsStarted()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should leave a backoff wait as soon as stop is requested")
    void shouldStopDuringBackoff() throws Exception {
        DevicePipeline pipeline = pipeline(settings()
                .backoffBase(Duration.ofMinutes(5))
                .backoffMax(Duration.ofMinutes(5))
                .build());
        transport.failSubscribes(100);
        Thread thread = new Thread(pipeline, "pipeline-test");
        thread.start();

        while (pipeline.getState() != PipelineState.RECONNECTING) {
            Thread.sleep(5);
        }
        long begin = System.nanoTime();
        pipeline.requestStop();

        assertThat(pipeline.awaitStopped(Duration.ofSeconds(5))).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofSeconds(2));
        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
        thread.join(1000);
    }

    @Test
    @DisplayName("Should shut down immediately when stopped before running")
    void shouldHonourEarlyStop() {
        DevicePipeline pipeline = pipeline(settings().build());
        pipeline.requestStop();

        pipeline.run();

        assertThat(pipeline.getState()).isEqualTo(PipelineState.STOPPED);
        assertThat(transport.subscribeCalls()).isZero();
    }
}
