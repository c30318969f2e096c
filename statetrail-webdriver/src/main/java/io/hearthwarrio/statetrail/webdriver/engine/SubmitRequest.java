package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.TaskContext;

import java.util.List;
import java.util.Objects;

public final class SubmitRequest {

    private final List<String> candidateTexts;
    private final TaskContext task;

    public SubmitRequest(List<String> candidateTexts, TaskContext task) {
        this.candidateTexts = List.copyOf(Objects.requireNonNull(candidateTexts, "candidateTexts must not be null"));
        this.task = Objects.requireNonNull(task, "task must not be null");
    }

    public List<String> getCandidateTexts() {
        return candidateTexts;
    }

    public TaskContext getTask() {
        return task;
    }

    @Override
    public String toString() {
        return "SubmitRequest{" + candidateTexts + '}';
    }
}
