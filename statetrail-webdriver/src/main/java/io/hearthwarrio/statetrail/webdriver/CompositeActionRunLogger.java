package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.action.Action;
import io.hearthwarrio.statetrail.webdriver.snapshot.CaptureOutcome;

import java.util.List;
import java.util.Objects;

/**
 * Forwards every event to each delegate, in order.
 */
public final class CompositeActionRunLogger implements ActionRunLogger {

    private final List<ActionRunLogger> delegates;

    public CompositeActionRunLogger(List<ActionRunLogger> delegates) {
        Objects.requireNonNull(delegates, "delegates must not be null");
        this.delegates = List.copyOf(delegates);
    }

    public static ActionRunLogger of(ActionRunLogger... delegates) {
        return new CompositeActionRunLogger(List.of(delegates));
    }

    public List<ActionRunLogger> getDelegates() {
        return delegates;
    }

    @Override
    public void planReady(List<Action> actions) {
        delegates.forEach(d -> d.planReady(actions));
    }

    @Override
    public void actionStarted(int step, int total, Action action) {
        delegates.forEach(d -> d.actionStarted(step, total, action));
    }

    @Override
    public void actionFinished(int step, int total, Action action, ActionResult result) {
        delegates.forEach(d -> d.actionFinished(step, total, action, result));
    }

    @Override
    public void stateCaptured(CaptureOutcome outcome) {
        delegates.forEach(d -> d.stateCaptured(outcome));
    }

    @Override
    public void captureSkipped(CaptureOutcome outcome) {
        delegates.forEach(d -> d.captureSkipped(outcome));
    }

    @Override
    public void captureFailed(CaptureOutcome outcome) {
        delegates.forEach(d -> d.captureFailed(outcome));
    }

    @Override
    public void loginCheckpoint(AuthState state) {
        delegates.forEach(d -> d.loginCheckpoint(state));
    }

    @Override
    public void loginResumed(AuthState state) {
        delegates.forEach(d -> d.loginResumed(state));
    }
}
