/**
 * Recording side effects.
 *
 * <p>
 * {@link com.camsentinel.core.recording.RecordingSessionManager} executes
 * start, extend and stop commands for one device, writing through
 * {@link com.camsentinel.core.recording.OutputLayout} and delegating to the
 * {@link com.camsentinel.core.recording.SnapshotFetcher} and
 * {@link com.camsentinel.core.recording.CaptureProcessLauncher}
 * collaborators.
 * </p>
 *
 * @since 1.0.0
 */
package com.camsentinel.core.recording;
