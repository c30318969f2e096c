package io.hearthwarrio.statetrail.core.action;

public final class CaptureStateAction implements Action {

    @Override
    public ActionKind kind() {
        return ActionKind.CAPTURE_STATE;
    }

    @Override
    public String describe() {
        return "capture_state -> capturing screenshot";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CaptureStateAction;
    }

    @Override
    public int hashCode() {
        return kind().hashCode();
    }

    @Override
    public String toString() {
        return "CaptureStateAction{}";
    }
}
