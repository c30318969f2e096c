package io.hearthwarrio.statetrail.core.action;

public final class WaitForModalAction implements Action {

    @Override
    public ActionKind kind() {
        return ActionKind.WAIT_FOR_MODAL;
    }

    @Override
    public String describe() {
        return "wait_for_modal -> waiting for modal/dialog";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WaitForModalAction;
    }

    @Override
    public int hashCode() {
        return kind().hashCode();
    }

    @Override
    public String toString() {
        return "WaitForModalAction{}";
    }
}
