package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.Slugs;
import io.hearthwarrio.statetrail.core.TaskContext;
import io.hearthwarrio.statetrail.core.action.Action;
import io.hearthwarrio.statetrail.core.action.ActionPlanner;
import io.hearthwarrio.statetrail.core.config.StateTrailSettings;
import io.hearthwarrio.statetrail.webdriver.engine.ActionEngine;
import io.hearthwarrio.statetrail.webdriver.engine.ConsoleOperatorGate;
import io.hearthwarrio.statetrail.webdriver.engine.OperatorGate;
import io.hearthwarrio.statetrail.webdriver.snapshot.SnapshotCaptureException;
import io.hearthwarrio.statetrail.webdriver.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs one task end to end: snapshot directory {@code <dataset_root>/<task slug>}, engine, loggers,
 * and {@code summary.json} at the end.
 * <p>
 * Typical usage:
 * <pre>{@code
 * try (BrowserSession session = new BrowserSession(driver)) {
 *     RunOutcome outcome = new StateTrailRun(settings, session, "Create a project in Linear")
 *             .run(planner);
 * }
 * }</pre>
 */
public final class StateTrailRun {

    private static final Logger log = LoggerFactory.getLogger(StateTrailRun.class);

    static final String FALLBACK_SLUG = "task";

    private final StateTrailSettings settings;
    private final BrowserSession session;
    private final TaskContext task;
    private final SnapshotStore store;

    private ActionRunLogger extraLogger;
    private OperatorGate gate = ConsoleOperatorGate.system();

    public StateTrailRun(StateTrailSettings settings, BrowserSession session, String taskText) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.task = TaskContext.of(taskText);
        this.store = new SnapshotStore(settings.getDatasetRoot(), slugFor(taskText));
    }

    /**
     * Adds a listener next to the default SLF4J one.
     */
    public StateTrailRun withLogger(ActionRunLogger logger) {
        this.extraLogger = Objects.requireNonNull(logger, "logger must not be null");
        return this;
    }

    public StateTrailRun withOperatorGate(OperatorGate gate) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        return this;
    }

    public TaskContext getTask() {
        return task;
    }

    public SnapshotStore getStore() {
        return store;
    }

    public RunOutcome run(ActionPlanner planner) {
        Objects.requireNonNull(planner, "planner must not be null");
        List<Action> actions = planner.plan(task);
        log.info("Planned {} actions for '{}'", actions.size(), task.getDescription());
        return run(actions);
    }

    /**
     * @throws RunCancelledException after closing the browser session, when the run was interrupted
     */
    public RunOutcome run(List<Action> actions) {
        ActionEngine engine = new ActionEngine(new PageProbe(session.getDriver()), settings, store)
                .withTask(task)
                .withOperatorGate(gate)
                .withLogger(logger());

        List<ActionResult> results;
        try {
            results = engine.run(actions);
        } catch (RunCancelledException e) {
            writeSummaryQuietly();
            session.close();
            throw e;
        }
        Path summaryFile = store.writeSummary();
        log.info("Run finished: {} states captured in {}", store.getIndex(), store.getTaskDir());
        return new RunOutcome(results, store.summary(), summaryFile);
    }

    private ActionRunLogger logger() {
        ActionRunLogger base = new Slf4jActionRunLogger();
        return extraLogger == null ? base : CompositeActionRunLogger.of(base, extraLogger);
    }

    private void writeSummaryQuietly() {
        try {
            store.writeSummary();
        } catch (SnapshotCaptureException e) {
            log.warn("Summary not written after cancellation: {}", e.getMessage());
        }
    }

    static String slugFor(String taskText) {
        String slug = Slugs.slugify(taskText == null ? "" : taskText);
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }
}
