package io.hearthwarrio.statetrail.allure;

import io.hearthwarrio.statetrail.webdriver.ActionRunLogger;

/**
 * Factory methods for Allure-related StateTrail loggers.
 * <p>
 * This class lives in the statetrail-allure module to avoid leaking Allure
 * dependencies into statetrail-core or statetrail-webdriver.
 */
public final class StateTrailAllureLoggers {

    private StateTrailAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that attaches results and state metadata, with screenshots.
     */
    public static ActionRunLogger runSteps() {
        return new AllureActionRunLogger(true);
    }

    /**
     * Creates an Allure logger with an explicit screenshot flag.
     */
    public static ActionRunLogger runSteps(boolean screenshots) {
        return new AllureActionRunLogger(screenshots);
    }
}
