package com.camsentinel.core.recording;

import java.io.IOException;
import java.time.Duration;
import java.util.OptionalInt;

/**
 * Handle on one running external capture process.
 *
 * <p>
 * Stopping is escalated by the caller: {@link #requestGracefulStop()} first
 * (the recorder finalizes its output file), then {@link #terminate()}, then
 * {@link #kill()}.
 * </p>
 */
public interface CaptureProcess {

    boolean isAlive();

    /**
     * Ask the recorder to finish its output file and exit.
     *
     * @throws IOException if the request could not be delivered
     */
    void requestGracefulStop() throws IOException;

    /**
     * @param timeout maximum wait
     * @return {@code true} if the process exited within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitExit(Duration timeout) throws InterruptedException;

    /** Ask the operating system to terminate the process. */
    void terminate();

    /** Forcibly kill the process. */
    void kill();

    /** @return the exit code once the process has exited */
    OptionalInt exitCode();

    /** @return the last lines of the recorder's diagnostic output, may be empty */
    String diagnosticTail();
}
