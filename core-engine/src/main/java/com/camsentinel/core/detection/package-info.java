/**
 * Per-device detection logic.
 *
 * <p>
 * {@link com.camsentinel.core.detection.DetectionStateMachine} consumes
 * {@link com.camsentinel.core.model.DetectionEvent}s and emits
 * {@link com.camsentinel.core.detection.SessionCommand}s (start, extend,
 * stop). It performs no I/O; executing the commands is the job of the
 * recording layer.
 * </p>
 *
 * @since 1.0.0
 */
package com.camsentinel.core.detection;
