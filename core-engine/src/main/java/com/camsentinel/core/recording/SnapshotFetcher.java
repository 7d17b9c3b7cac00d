package com.camsentinel.core.recording;

import com.camsentinel.core.model.DeviceConfig;

import java.io.IOException;

/**
 * Fetches a single still image from a device.
 */
public interface SnapshotFetcher {

    /**
     * @param device the device
     * @return the encoded image (JPEG)
     * @throws IOException if the device could not deliver an image
     */
    byte[] fetch(DeviceConfig device) throws IOException;
}
