package io.hearthwarrio.statetrail.testkit;

import io.hearthwarrio.statetrail.core.config.StateTrailSettings;
import io.hearthwarrio.statetrail.webdriver.BrowserSession;
import io.hearthwarrio.statetrail.webdriver.StateTrailRun;
import io.hearthwarrio.statetrail.webdriver.engine.OperatorGate;

import java.util.Objects;

/**
 * Convenience factory methods for creating runs in tests.
 * <p>
 * Keeps test code minimal and consistent.
 * Does not depend on Allure.
 */
public final class TestStateTrail {

    private TestStateTrail() {
        // utility class
    }

    /**
     * Creates a Chrome-backed session for the given settings.
     */
    public static BrowserSession chromeSession(StateTrailSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new BrowserSession(TestDrivers.chrome(settings));
    }

    /**
     * Creates an unattended run: the login checkpoint never blocks.
     */
    public static StateTrailRun unattended(StateTrailSettings settings, BrowserSession session, String task) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(session, "session must not be null");
        return new StateTrailRun(settings, session, task)
                .withOperatorGate(OperatorGate.proceedImmediately());
    }

    /**
     * Creates an interactive run that waits on the console at login checkpoints.
     */
    public static StateTrailRun interactive(StateTrailSettings settings, BrowserSession session, String task) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(session, "session must not be null");
        return new StateTrailRun(settings, session, task);
    }
}
