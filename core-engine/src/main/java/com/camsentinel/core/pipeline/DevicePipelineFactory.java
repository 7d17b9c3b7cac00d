package com.camsentinel.core.pipeline;

import com.camsentinel.core.model.DeviceConfig;

/**
 * Creates a fresh {@link DevicePipeline} for a device. Called once at start
 * and again for every restart after a failure.
 */
@FunctionalInterface
public interface DevicePipelineFactory {

    DevicePipeline create(DeviceConfig device);
}
