package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.TaskContext;

import java.util.Objects;

public final class ClickRequest {

    private final String text;
    private final TaskContext task;

    public ClickRequest(String text, TaskContext task) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
    }

    public String getText() {
        return text;
    }

    public TaskContext getTask() {
        return task;
    }

    public boolean isSingleWord() {
        String t = text.trim();
        return !t.isEmpty() && t.split("\\s+").length == 1;
    }

    @Override
    public String toString() {
        return "ClickRequest{'" + text + "'}";
    }
}
