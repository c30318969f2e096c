package io.hearthwarrio.statetrail.core.action;

import java.util.Locale;
import java.util.Objects;

/**
 * Plan entry with a type the engine does not support.
 * <p>
 * Kept in the plan so the engine can report it as a failed result instead of silently dropping it.
 */
public final class UnknownAction implements Action {

    private final String rawType;

    public UnknownAction(String rawType) {
        this.rawType = rawType == null ? "" : rawType.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.UNKNOWN;
    }

    @Override
    public String type() {
        return rawType;
    }

    @Override
    public String describe() {
        return rawType.isEmpty() ? "unknown" : rawType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnknownAction)) return false;
        return rawType.equals(((UnknownAction) o).rawType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), rawType);
    }

    @Override
    public String toString() {
        return "UnknownAction{type='" + rawType + "'}";
    }
}
