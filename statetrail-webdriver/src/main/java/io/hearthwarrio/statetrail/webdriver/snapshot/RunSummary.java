package io.hearthwarrio.statetrail.webdriver.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"task_slug", "total_states", "task_dir", "states"})
public final class RunSummary {

    private final String taskSlug;
    private final int totalStates;
    private final String taskDir;
    private final List<CapturedState> states;

    @JsonCreator
    public RunSummary(
            @JsonProperty("task_slug") String taskSlug,
            @JsonProperty("total_states") int totalStates,
            @JsonProperty("task_dir") String taskDir,
            @JsonProperty("states") List<CapturedState> states
    ) {
        this.taskSlug = Objects.requireNonNull(taskSlug, "taskSlug must not be null");
        this.totalStates = totalStates;
        this.taskDir = Objects.requireNonNull(taskDir, "taskDir must not be null");
        this.states = states == null ? List.of() : List.copyOf(states);
    }

    @JsonProperty("task_slug")
    public String getTaskSlug() {
        return taskSlug;
    }

    @JsonProperty("total_states")
    public int getTotalStates() {
        return totalStates;
    }

    @JsonProperty("task_dir")
    public String getTaskDir() {
        return taskDir;
    }

    @JsonProperty("states")
    public List<CapturedState> getStates() {
        return states;
    }

    @Override
    public String toString() {
        return "RunSummary{" + taskSlug + ", states=" + totalStates + ", dir=" + taskDir + '}';
    }
}
