package io.hearthwarrio.statetrail.webdriver.snapshot;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of a capture attempt: a new state, a skip because nothing changed, or a failure.
 */
public final class CaptureOutcome {

    public enum Status {
        CAPTURED,
        SKIPPED,
        FAILED
    }

    private final Status status;
    private final String step;
    private final CapturedState state;
    private final Path screenshotFile;
    private final Path metadataFile;
    private final Exception error;

    private CaptureOutcome(Status status, String step, CapturedState state, Path screenshotFile, Path metadataFile, Exception error) {
        this.status = status;
        this.step = step;
        this.state = state;
        this.screenshotFile = screenshotFile;
        this.metadataFile = metadataFile;
        this.error = error;
    }

    static CaptureOutcome captured(CapturedState state, Path screenshotFile, Path metadataFile) {
        Objects.requireNonNull(state, "state must not be null");
        return new CaptureOutcome(Status.CAPTURED, state.getStep(), state, screenshotFile, metadataFile, null);
    }

    static CaptureOutcome skipped(String step) {
        return new CaptureOutcome(Status.SKIPPED, step, null, null, null, null);
    }

    static CaptureOutcome failed(String step, Exception error) {
        return new CaptureOutcome(Status.FAILED, step, null, null, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCaptured() {
        return status == Status.CAPTURED;
    }

    public String getStep() {
        return step;
    }

    /**
     * @return captured metadata, or null unless {@link Status#CAPTURED}
     */
    public CapturedState getState() {
        return state;
    }

    public Path getScreenshotFile() {
        return screenshotFile;
    }

    public Path getMetadataFile() {
        return metadataFile;
    }

    /**
     * @return failure cause, or null unless {@link Status#FAILED}
     */
    public Exception getError() {
        return error;
    }

    @Override
    public String toString() {
        return "CaptureOutcome{" + status + " " + step +
                (state == null ? "" : ", #" + state.getIndex()) +
                (error == null ? "" : ", error=" + error.getMessage()) +
                '}';
    }
}
