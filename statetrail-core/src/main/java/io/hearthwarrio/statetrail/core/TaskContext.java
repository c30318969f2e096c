package io.hearthwarrio.statetrail.core;

import java.util.Objects;

/**
 * Free-text task description threaded through a run. Read-only.
 */
public final class TaskContext {

    private static final TaskContext NONE = new TaskContext("");

    private final String description;

    private TaskContext(String description) {
        this.description = description;
    }

    public static TaskContext of(String description) {
        if (description == null || description.isBlank()) {
            return NONE;
        }
        return new TaskContext(description.trim());
    }

    /**
     * Context used when the caller supplies no task text; context-aware tiers are skipped.
     */
    public static TaskContext none() {
        return NONE;
    }

    public String getDescription() {
        return description;
    }

    public boolean isPresent() {
        return !description.isEmpty();
    }

    public String lower() {
        return Texts.lower(description);
    }

    public boolean mentions(String word) {
        return isPresent() && lower().contains(Texts.lower(word));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskContext)) return false;
        return description.equals(((TaskContext) o).description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description);
    }

    @Override
    public String toString() {
        return "TaskContext{'" + description + "'}";
    }
}
