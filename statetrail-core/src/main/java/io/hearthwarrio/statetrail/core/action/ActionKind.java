package io.hearthwarrio.statetrail.core.action;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of action types understood by the engine, keyed by their plan wire name.
 */
public enum ActionKind {
    GOTO("goto", true),
    CLICK_BY_TEXT("click_by_text", true),
    WAIT_FOR_MODAL("wait_for_modal", false),
    FILL_INPUTS("fill_inputs", true),
    CLICK_SUBMIT("click_submit", true),
    CAPTURE_STATE("capture_state", false),
    UNKNOWN("unknown", false);

    private final String wireName;
    private final boolean mutatesPage;

    ActionKind(String wireName, boolean mutatesPage) {
        this.wireName = wireName;
        this.mutatesPage = mutatesPage;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Whether the engine waits for network quiescence after this kind of action.
     */
    public boolean mutatesPage() {
        return mutatesPage;
    }

    /**
     * Case-insensitive lookup by wire name. {@link #UNKNOWN} is never returned.
     *
     * @param wireName plan type value (may be null)
     * @return matching kind or empty
     */
    public static Optional<ActionKind> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        String w = wireName.trim().toLowerCase(Locale.ROOT);
        for (ActionKind kind : values()) {
            if (kind != UNKNOWN && kind.wireName.equals(w)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
