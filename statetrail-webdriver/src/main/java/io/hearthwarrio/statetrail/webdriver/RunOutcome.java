package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.webdriver.snapshot.RunSummary;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Per-action results of a run together with the summary of the captured states.
 */
public final class RunOutcome {

    private final List<ActionResult> results;
    private final RunSummary summary;
    private final Path summaryFile;

    public RunOutcome(List<ActionResult> results, RunSummary summary, Path summaryFile) {
        this.results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.summaryFile = summaryFile;
    }

    public List<ActionResult> getResults() {
        return results;
    }

    public RunSummary getSummary() {
        return summary;
    }

    public Path getSummaryFile() {
        return summaryFile;
    }

    public boolean isAllSucceeded() {
        return results.stream().allMatch(ActionResult::isSuccess);
    }

    public List<ActionResult> getFailures() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "RunOutcome{actions=" + results.size() +
                ", failures=" + getFailures().size() +
                ", summary=" + summary +
                '}';
    }
}
