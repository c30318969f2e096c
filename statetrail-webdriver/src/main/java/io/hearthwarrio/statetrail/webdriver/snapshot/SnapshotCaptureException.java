package io.hearthwarrio.statetrail.webdriver.snapshot;

/**
 * Raised when the snapshot directory cannot be prepared or a record cannot be written.
 */
public class SnapshotCaptureException extends RuntimeException {

    public SnapshotCaptureException(String message) {
        super(message);
    }

    public SnapshotCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
