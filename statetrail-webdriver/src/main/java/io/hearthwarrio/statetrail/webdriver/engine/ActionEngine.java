package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.AuthStateClassifier;
import io.hearthwarrio.statetrail.core.ElementMatcher;
import io.hearthwarrio.statetrail.core.FieldSynonymClass;
import io.hearthwarrio.statetrail.core.TaskContext;
import io.hearthwarrio.statetrail.core.action.Action;
import io.hearthwarrio.statetrail.core.action.ActionKind;
import io.hearthwarrio.statetrail.core.action.ClickByTextAction;
import io.hearthwarrio.statetrail.core.action.ClickSubmitAction;
import io.hearthwarrio.statetrail.core.action.FillInputsAction;
import io.hearthwarrio.statetrail.core.action.GotoAction;
import io.hearthwarrio.statetrail.core.config.StateTrailSettings;
import io.hearthwarrio.statetrail.core.config.Timeouts;
import io.hearthwarrio.statetrail.webdriver.ActionRunLogger;
import io.hearthwarrio.statetrail.webdriver.AuthStateDetector;
import io.hearthwarrio.statetrail.webdriver.ModalSelectors;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSettler;
import io.hearthwarrio.statetrail.webdriver.PageSummaryReader;
import io.hearthwarrio.statetrail.webdriver.RunCancelledException;
import io.hearthwarrio.statetrail.webdriver.Slf4jActionRunLogger;
import io.hearthwarrio.statetrail.webdriver.WebDriverPageSummaryReader;
import io.hearthwarrio.statetrail.webdriver.snapshot.CaptureOutcome;
import io.hearthwarrio.statetrail.webdriver.snapshot.SnapshotStore;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.SessionNotCreatedException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Executes an action plan against the live page, one action at a time, and records a snapshot of
 * every UI state the plan produces.
 * <p>
 * Resolution failures never escape {@link #execute(Action)}: they become a failed {@link ActionResult}.
 * Only a lost browser session and cancellation abort the run.
 * <p>
 * Typical usage:
 * <pre>{@code
 * ActionEngine engine = new ActionEngine(new PageProbe(driver), settings, store)
 *         .withTask(TaskContext.of("create a project called Alpha"));
 * List<ActionResult> results = engine.run(actions);
 * }</pre>
 */
public class ActionEngine {

    private static final Logger log = LoggerFactory.getLogger(ActionEngine.class);

    public static final String LOGIN_PAGE_SUFFIX = " - appears to be on login/authentication page";
    public static final String AFTER_LOGIN_STEP = "after-login";

    private final PageProbe probe;
    private final StateTrailSettings settings;
    private final Timeouts timeouts;
    private final SnapshotStore store;
    private final PageSettler settler;
    private final ElementMatcher matcher;
    private final Interactions interactions;
    private final CookieConsent cookieConsent;

    private PageSummaryReader summaryReader;
    private AuthStateDetector detector;
    private ActionRunLogger logger = new Slf4jActionRunLogger();
    private OperatorGate gate = ConsoleOperatorGate.system();
    private TaskContext task = TaskContext.none();

    private List<? extends ResolutionStrategy<ClickRequest>> clickTiers;
    private List<? extends ResolutionStrategy<FieldRequest>> fillTiers;
    private List<? extends ResolutionStrategy<SubmitRequest>> submitTiers;

    public ActionEngine(PageProbe probe, StateTrailSettings settings, SnapshotStore store) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.timeouts = settings.getTimeouts();
        this.settler = new PageSettler(probe);
        this.matcher = new ElementMatcher(settings.getMatcher());
        this.interactions = new Interactions(probe, settler, timeouts.afterScroll());
        this.cookieConsent = new CookieConsent(probe, settler, timeouts.loginProbe(), timeouts.quickProbe());
        this.summaryReader = new WebDriverPageSummaryReader(probe);
        this.detector = new AuthStateDetector(probe, timeouts.loginProbe());
    }

    public ActionEngine withLogger(ActionRunLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        return this;
    }

    public ActionEngine withOperatorGate(OperatorGate gate) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        return this;
    }

    /**
     * Free-text task the plan was made for. Enables the context-aware tiers.
     */
    public ActionEngine withTask(TaskContext task) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        return this;
    }

    public ActionEngine withSummaryReader(PageSummaryReader reader) {
        this.summaryReader = Objects.requireNonNull(reader, "reader must not be null");
        return this;
    }

    public ActionEngine withDetector(AuthStateDetector detector) {
        this.detector = Objects.requireNonNull(detector, "detector must not be null");
        return this;
    }

    public ActionEngine withClickTiers(List<? extends ResolutionStrategy<ClickRequest>> tiers) {
        this.clickTiers = List.copyOf(Objects.requireNonNull(tiers, "tiers must not be null"));
        return this;
    }

    public ActionEngine withFillTiers(List<? extends ResolutionStrategy<FieldRequest>> tiers) {
        this.fillTiers = List.copyOf(Objects.requireNonNull(tiers, "tiers must not be null"));
        return this;
    }

    public ActionEngine withSubmitTiers(List<? extends ResolutionStrategy<SubmitRequest>> tiers) {
        this.submitTiers = List.copyOf(Objects.requireNonNull(tiers, "tiers must not be null"));
        return this;
    }

    public TaskContext getTask() {
        return task;
    }

    public SnapshotStore getStore() {
        return store;
    }

    /**
     * Runs the whole plan: initial capture, then per action execute, login checkpoint after navigation,
     * settle, capture and pacing.
     *
     * @return one result per action, in plan order
     * @throws RunCancelledException   if the run thread was interrupted
     * @throws NoSuchSessionException  if the browser session was lost
     */
    public List<ActionResult> run(List<Action> actions) {
        Objects.requireNonNull(actions, "actions must not be null");
        WebDriver driver = probe.getDriver();
        List<ActionResult> results = new ArrayList<>(actions.size());
        int total = actions.size();

        logger.planReady(actions);
        report(store.captureInitial(driver));

        for (int i = 0; i < total; i++) {
            Action action = actions.get(i);
            int step = i + 1;
            logger.actionStarted(step, total, action);

            ActionResult result = execute(action);
            results.add(result);

            if (action instanceof GotoAction) {
                loginCheckpoint(driver);
            }
            logger.actionFinished(step, total, action, result);

            if (action.kind().mutatesPage()) {
                settler.awaitNetworkQuiet(timeouts.networkIdle());
            }
            settler.pause(timeouts.settleAfterAction());
            settler.pause(timeouts.settleBeforeCapture());
            report(store.captureIfChanged(driver, action.stepLabel(), result.isSuccess()));

            settler.pause(settings.getSlowMo());
        }
        return results;
    }

    /**
     * Executes a single action and never throws for resolution failures.
     *
     * @throws RunCancelledException   if the thread was interrupted during a pause
     * @throws NoSuchSessionException  if the browser session was lost
     */
    public ActionResult execute(Action action) {
        Objects.requireNonNull(action, "action must not be null");
        try {
            switch (action.kind()) {
                case GOTO:
                    return navigate((GotoAction) action);
                case CLICK_BY_TEXT:
                    return clickByText((ClickByTextAction) action);
                case WAIT_FOR_MODAL:
                    return waitForModal();
                case FILL_INPUTS:
                    return fillInputs((FillInputsAction) action);
                case CLICK_SUBMIT:
                    return clickSubmit((ClickSubmitAction) action);
                case CAPTURE_STATE:
                    return captureState();
                default:
                    return ActionResult.failure(action.type(), "Unknown action type: " + action.type()).build();
            }
        } catch (NoSuchSessionException | SessionNotCreatedException | RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Action {} failed", action.describe(), e);
            return ActionResult.failure(action.type(), messageOf(e)).build();
        }
    }

    private ActionResult navigate(GotoAction action) {
        String type = action.type();
        try {
            probe.getDriver().get(action.getUrl());
        } catch (TimeoutException e) {
            return ActionResult.failure(type, "Navigation timeout").detail(ActionResult.URL, action.getUrl()).build();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return ActionResult.failure(type, messageOf(e)).detail(ActionResult.URL, action.getUrl()).build();
        }
        settler.awaitNetworkQuiet(timeouts.navigation());
        return ActionResult.success(type).detail(ActionResult.URL, action.getUrl()).build();
    }

    private ActionResult clickByText(ClickByTextAction action) {
        String type = action.type();
        String text = action.getText();
        String notFound = "Element with text '" + text + "' not found";

        if (settings.isAuthPrecheck() && AuthStateClassifier.isDedicatedLoginPath(currentUrl())) {
            AuthState state = detector.detect();
            return ActionResult.failure(type, notFound + LOGIN_PAGE_SUFFIX)
                    .detail(ActionResult.AUTH_STATE, state)
                    .build();
        }

        Optional<TierOutcome> outcome = TierRunner.run(clickTiers(), new ClickRequest(text, task), interactions::click);
        if (outcome.isPresent()) {
            return ActionResult.success(type)
                    .method(outcome.get().getMethod())
                    .detail(ActionResult.TEXT, outcome.get().getLabel())
                    .build();
        }

        AuthState state = detector.detect();
        return ActionResult.failure(type, state.isLoginPage() ? notFound + LOGIN_PAGE_SUFFIX : notFound)
                .detail(ActionResult.AUTH_STATE, state)
                .build();
    }

    private ActionResult waitForModal() {
        String type = ActionKind.WAIT_FOR_MODAL.getWireName();
        for (String selector : ModalSelectors.CONTAINERS) {
            if (probe.firstVisible(By.cssSelector(selector), timeouts.modalProbe()).isPresent()) {
                return ActionResult.success(type).detail(ActionResult.SELECTOR, selector).build();
            }
        }
        return ActionResult.failure(type, "No modal found").build();
    }

    private ActionResult fillInputs(FillInputsAction action) {
        cookieConsent.dismiss();

        Map<String, String> filled = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        List<? extends ResolutionStrategy<FieldRequest>> tiers = fillTiers();

        for (Map.Entry<String, String> e : action.getInputs().entrySet()) {
            FieldRequest request = new FieldRequest(e.getKey(), e.getValue(), task);
            try {
                Optional<TierOutcome> outcome = TierRunner.run(tiers, request, t -> interactions.fill(t, request.getValue()));
                if (outcome.isPresent()) {
                    filled.put(e.getKey(), request.getValue());
                    log.debug("Filled '{}' via {}", e.getKey(), outcome.get().getMethod());
                } else {
                    errors.put(e.getKey(), "Field not found");
                }
            } catch (NoSuchSessionException | RunCancelledException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                errors.put(e.getKey(), messageOf(ex));
            }
        }

        boolean isSearch = filled.keySet().stream()
                .anyMatch(k -> FieldSynonymClass.of(k) == FieldSynonymClass.SEARCH);
        ActionResult.Builder b = filled.isEmpty()
                ? ActionResult.failure(action.type(), "Field not found: " + String.join(", ", action.getInputs().keySet()))
                : ActionResult.success(action.type());
        return b.detail(ActionResult.FILLED, filled)
                .detail(ActionResult.ERRORS, errors)
                .detail(ActionResult.IS_SEARCH, isSearch)
                .build();
    }

    private ActionResult clickSubmit(ClickSubmitAction action) {
        List<String> texts = action.getCandidateTexts().isEmpty()
                ? settings.getCommonButtonText()
                : action.getCandidateTexts();

        Optional<TierOutcome> outcome = TierRunner.run(submitTiers(), new SubmitRequest(texts, task), interactions::submit);
        if (outcome.isPresent()) {
            return ActionResult.success(action.type())
                    .method(outcome.get().getMethod())
                    .detail(ActionResult.BUTTON, outcome.get().getLabel())
                    .build();
        }
        return ActionResult.failure(action.type(), "No submit button found").build();
    }

    private ActionResult captureState() {
        String type = ActionKind.CAPTURE_STATE.getWireName();
        WebDriver driver = probe.getDriver();
        try {
            return ActionResult.success(type)
                    .detail(ActionResult.URL, driver.getCurrentUrl())
                    .detail(ActionResult.TITLE, driver.getTitle())
                    .build();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return ActionResult.failure(type, messageOf(e)).build();
        }
    }

    /**
     * Settles the page after navigation and suspends the run for a manual login when the checkpoint
     * policy asks for it.
     */
    private void loginCheckpoint(WebDriver driver) {
        settler.pause(timeouts.settleAfterGoto());
        settler.awaitDomReady(timeouts.domReady());
        settler.pause(timeouts.settleAfterReady());

        AuthState state = detector.detect();
        if (!settings.getCheckpoint().shouldSuspend(state)) {
            return;
        }

        logger.loginCheckpoint(state);
        gate.awaitResume(state);
        settler.pause(timeouts.settleAfterLogin());

        AuthState after = detector.detect();
        logger.loginResumed(after);
        report(store.captureIfChanged(driver, AFTER_LOGIN_STEP, true));
    }

    private void report(CaptureOutcome outcome) {
        switch (outcome.getStatus()) {
            case CAPTURED:
                logger.stateCaptured(outcome);
                break;
            case SKIPPED:
                logger.captureSkipped(outcome);
                break;
            default:
                logger.captureFailed(outcome);
                break;
        }
    }

    private String currentUrl() {
        try {
            String url = probe.getDriver().getCurrentUrl();
            return url == null ? "" : url;
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return "";
        }
    }

    private List<? extends ResolutionStrategy<ClickRequest>> clickTiers() {
        return clickTiers != null ? clickTiers : ClickByTextTiers.create(probe, matcher, summaryReader, timeouts);
    }

    private List<? extends ResolutionStrategy<FieldRequest>> fillTiers() {
        return fillTiers != null ? fillTiers : FillInputTiers.create(probe, matcher, summaryReader, timeouts);
    }

    private List<? extends ResolutionStrategy<SubmitRequest>> submitTiers() {
        return submitTiers != null ? submitTiers : ClickSubmitTiers.create(probe, matcher, summaryReader, timeouts);
    }

    private static String messageOf(RuntimeException e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            return e.getClass().getSimpleName();
        }
        // Selenium appends build and system info after the first line.
        int nl = m.indexOf('\n');
        return nl > 0 ? m.substring(0, nl) : m;
    }
}
