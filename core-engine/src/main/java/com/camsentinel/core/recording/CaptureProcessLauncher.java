package com.camsentinel.core.recording;

import com.camsentinel.core.model.DeviceConfig;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Starts the external recorder that copies a device's media stream into a
 * file without re-encoding.
 */
public interface CaptureProcessLauncher {

    /**
     * @param device   device whose stream is recorded
     * @param clipPath destination file
     * @return handle on the running recorder
     * @throws IOException if the recorder could not be started
     */
    CaptureProcess launch(DeviceConfig device, Path clipPath) throws IOException;
}
