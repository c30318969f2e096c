package io.hearthwarrio.statetrail.webdriver;

/**
 * Thrown when the run thread is interrupted while paused or waiting for the operator.
 * <p>
 * Already persisted captures stay intact; the caller is expected to close the browser session.
 */
public class RunCancelledException extends RuntimeException {
    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
