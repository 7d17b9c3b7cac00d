/**
 * Per-device pipelines and their supervisor.
 *
 * <p>
 * A {@link com.camsentinel.core.pipeline.DevicePipeline} combines one
 * device's subscription client, detection state machine and recording
 * session manager into a single loop.
 * {@link com.camsentinel.core.pipeline.CameraSupervisor} runs one pipeline
 * per enabled device, isolates their failures and coordinates shutdown.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.camsentinel.core.pipeline.PipelineSettings}: settings
 * shared by all pipelines</li>
 * <li>{@link com.camsentinel.core.pipeline.PipelineStatus}: per-device
 * status snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.camsentinel.core.pipeline;
