package io.hearthwarrio.statetrail.core.action;

/**
 * Thrown when a plan cannot be parsed into actions.
 */
public class ActionPlanException extends RuntimeException {
    public ActionPlanException(String message) {
        super(message);
    }

    public ActionPlanException(String message, Throwable cause) {
        super(message, cause);
    }
}
