package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.action.Action;
import io.hearthwarrio.statetrail.webdriver.snapshot.CaptureOutcome;

import java.util.List;

/**
 * Receives run-level events from the action engine.
 * <p>
 * Implementations may log to SLF4J, Allure, files, etc. All methods default to no-ops so that a
 * listener only overrides what it cares about.
 */
public interface ActionRunLogger {

    default void planReady(List<Action> actions) {
    }

    /**
     * @param step  1-based position in the plan
     * @param total plan size
     */
    default void actionStarted(int step, int total, Action action) {
    }

    default void actionFinished(int step, int total, Action action, ActionResult result) {
    }

    default void stateCaptured(CaptureOutcome outcome) {
    }

    default void captureSkipped(CaptureOutcome outcome) {
    }

    default void captureFailed(CaptureOutcome outcome) {
    }

    /**
     * Called before the run suspends for a manual login.
     */
    default void loginCheckpoint(AuthState state) {
    }

    /**
     * Called after the operator resumed the run, with the re-detected state.
     */
    default void loginResumed(AuthState state) {
    }
}
