package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.AuthState;

/**
 * External resume signal for a run suspended at a login checkpoint.
 */
@FunctionalInterface
public interface OperatorGate {

    /**
     * Blocks until the operator signals that the run may continue.
     *
     * @param state auth state that caused the suspension
     * @throws io.hearthwarrio.statetrail.webdriver.RunCancelledException if the wait was interrupted
     */
    void awaitResume(AuthState state);

    /**
     * Gate that never blocks. For unattended runs against pages that need no login.
     */
    static OperatorGate proceedImmediately() {
        return state -> {
        };
    }
}
