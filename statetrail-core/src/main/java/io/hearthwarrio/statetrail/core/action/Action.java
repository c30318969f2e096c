package io.hearthwarrio.statetrail.core.action;

import java.util.Locale;

/**
 * One abstract instruction of a plan.
 * <p>
 * Actions are immutable and consumed exactly once, in plan order, by the engine.
 */
public interface Action {

    ActionKind kind();

    /**
     * Wire name of the action type as it appeared in the plan.
     *
     * @return type name, never null
     */
    default String type() {
        return kind().getWireName();
    }

    /**
     * Label used for captured states produced after this action ({@code click_by_text} becomes {@code click-by-text}).
     *
     * @return step label
     */
    default String stepLabel() {
        return type().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Short human readable description for plan listings.
     *
     * @return description
     */
    String describe();
}
