package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.action.Action;
import io.hearthwarrio.statetrail.webdriver.snapshot.CaptureOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default run logger: one line per event on the {@code io.hearthwarrio.statetrail.run} logger.
 */
public final class Slf4jActionRunLogger implements ActionRunLogger {

    private static final Logger log = LoggerFactory.getLogger("io.hearthwarrio.statetrail.run");

    @Override
    public void planReady(List<Action> actions) {
        log.info("Executing {} actions", actions.size());
    }

    @Override
    public void actionStarted(int step, int total, Action action) {
        log.info("[{}/{}] {}", step, total, action.type());
        log.debug("[{}/{}] {}", step, total, action.describe());
    }

    @Override
    public void actionFinished(int step, int total, Action action, ActionResult result) {
        if (result.isSuccess()) {
            log.info("[{}/{}] succeeded{}", step, total, result.getMethod() == null ? "" : " via " + result.getMethod());
        } else {
            log.warn("[{}/{}] failed: {}", step, total, result.getError() == null ? "Unknown error" : result.getError());
        }
    }

    @Override
    public void stateCaptured(CaptureOutcome outcome) {
        log.debug("State {} written to {}", outcome.getState().getIndex(), outcome.getScreenshotFile());
    }

    @Override
    public void captureSkipped(CaptureOutcome outcome) {
        log.debug("Capture skipped for {}", outcome.getStep());
    }

    @Override
    public void captureFailed(CaptureOutcome outcome) {
        log.warn("Capture failed for {}", outcome.getStep(), outcome.getError());
    }

    @Override
    public void loginCheckpoint(AuthState state) {
        if (state.hasLoginButton()) {
            log.warn("Login required at {} (login button '{}')", state.getUrl(), state.getLoginButtonText());
        } else {
            log.warn("Login required at {}", state.getUrl());
        }
    }

    @Override
    public void loginResumed(AuthState state) {
        if (state.requiresLogin()) {
            log.warn("Still appears to require login at {}; continuing anyway", state.getUrl());
        } else {
            log.info("Login detected, continuing");
        }
    }
}
