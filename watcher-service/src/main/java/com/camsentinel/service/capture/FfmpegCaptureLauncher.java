package com.camsentinel.service.capture;

import com.camsentinel.core.model.DeviceConfig;
import com.camsentinel.core.recording.CaptureProcess;
import com.camsentinel.core.recording.CaptureProcessLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Launches {@code ffmpeg} to copy a camera's RTSP main stream into an MP4
 * file.
 *
 * <h3>Command</h3>
 *
 * <pre>
 *   ffmpeg -hide_banner -nostats -loglevel warning -rtsp_transport tcp -i rtsp://…
 *          -c:v copy -c:a &lt;audioCodec&gt; -movflags +faststart -f mp4 -y &lt;clip&gt;
 * </pre>
 *
 * <p>
 * Video is stream-copied, so recording costs no decode or encode work.
 * {@code +faststart} relocates the index when ffmpeg finalizes the file, which
 * is why the recorder must be stopped gracefully.
 * </p>
 *
 * @since 1.0.0
 */
public class FfmpegCaptureLauncher implements CaptureProcessLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(FfmpegCaptureLauncher.class);

    private final String ffmpegPath;
    private final String audioCodec;

    /**
     * @param ffmpegPath executable name or path
     * @param audioCodec {@code copy}, or an encoder name such as {@code aac}
     */
    public FfmpegCaptureLauncher(String ffmpegPath, String audioCodec) {
        this.ffmpegPath = Objects.requireNonNull(ffmpegPath, "ffmpegPath must not be null");
        this.audioCodec = Objects.requireNonNull(audioCodec, "audioCodec must not be null");
    }

    @Override
    public CaptureProcess launch(DeviceConfig device, Path clip) throws IOException {
        List<String> command = command(device, clip);
        LOG.debug("Launching: {}", String.join(" ", command).replace(rtspUrl(device), maskedRtspUrl(device)));

        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);
        Process process = builder.start();
        LOG.info("Recorder started (pid {}) for {}", process.pid(), clip.getFileName());
        return new FfmpegCaptureProcess(process, device.getName());
    }

    // ---------------------------------------------------------------
    // Command construction
    // ---------------------------------------------------------------

    /**
     * @param device the camera
     * @param clip   output file
     * @return the full argument list, executable first
     */
    List<String> command(DeviceConfig device, Path clip) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        command.add("-nostats");
        command.add("-loglevel");
        command.add("warning");
        command.add("-rtsp_transport");
        command.add("tcp");
        command.add("-i");
        command.add(rtspUrl(device));
        command.add("-c:v");
        command.add("copy");
        command.add("-c:a");
        command.add(audioCodec);
        if ("aac".equals(audioCodec)) {
            command.add("-b:a");
            command.add("128k");
        }
        command.add("-movflags");
        command.add("+faststart");
        command.add("-f");
        command.add("mp4");
        command.add("-y");
        command.add(clip.toString());
        return command;
    }

    /**
     * Main-stream RTSP URL of a channel: {@code Preview_01_main} for channel 0,
     * prefixed with {@code h265} for H.265 streams.
     *
     * @param device the camera
     * @return the URL including URL-encoded credentials
     */
    static String rtspUrl(DeviceConfig device) {
        return "rtsp://" + encode(device.getUsername()) + ":" + encode(device.getPassword())
                + "@" + hostAndPort(device) + "/" + streamPath(device);
    }

    static String maskedRtspUrl(DeviceConfig device) {
        return "rtsp://***@" + hostAndPort(device) + "/" + streamPath(device);
    }

    private static String hostAndPort(DeviceConfig device) {
        return device.getHost() + ":" + device.getRtspPort();
    }

    private static String streamPath(DeviceConfig device) {
        String prefix = "h265".equals(device.getStreamFormat()) ? "h265Preview_" : "Preview_";
        return prefix + String.format("%02d", device.getChannel() + 1) + "_main";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
