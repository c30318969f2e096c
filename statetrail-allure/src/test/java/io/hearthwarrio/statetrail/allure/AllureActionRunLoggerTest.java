package io.hearthwarrio.statetrail.allure;

import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.action.ClickByTextAction;
import io.hearthwarrio.statetrail.core.action.GotoAction;
import io.hearthwarrio.statetrail.webdriver.ActionRunLogger;
import io.qameta.allure.Allure;
import io.qameta.allure.AllureLifecycle;
import io.qameta.allure.AllureResultsWriter;
import io.qameta.allure.model.Attachment;
import io.qameta.allure.model.Status;
import io.qameta.allure.model.StepResult;
import io.qameta.allure.model.TestResult;
import io.qameta.allure.model.TestResultContainer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AllureActionRunLoggerTest {
    private final List<TestResult> written = new ArrayList<>();
    private final List<String> attachmentSources = new ArrayList<>();

    private AllureLifecycle previous;
    private AllureLifecycle lifecycle;
    private String uuid;

    @BeforeEach
    void startTestCase() {
        previous = Allure.getLifecycle();
        lifecycle = new AllureLifecycle(new AllureResultsWriter() {
            @Override
            public void write(TestResult testResult) {
                written.add(testResult);
            }

            @Override
            public void write(TestResultContainer testResultContainer) {
            }

            @Override
            public void write(String source, InputStream attachment) {
                attachmentSources.add(source);
            }
        });
        Allure.setLifecycle(lifecycle);
        uuid = UUID.randomUUID().toString();
        lifecycle.scheduleTestCase(new TestResult().setUuid(uuid).setName("statetrail run"));
        lifecycle.startTestCase(uuid);
    }

    @AfterEach
    void restoreLifecycle() {
        Allure.setLifecycle(previous);
    }

    private TestResult finish() {
        lifecycle.stopTestCase(uuid);
        lifecycle.writeTestCase(uuid);
        assertEquals(1, written.size());
        return written.get(0);
    }

    private static List<String> names(List<Attachment> attachments) {
        return attachments.stream().map(Attachment::getName).collect(Collectors.toList());
    }

    @Test
    void planIsAttachedToTestCase() {
        ActionRunLogger logger = StateTrailAllureLoggers.runSteps();

        logger.planReady(List.of(new GotoAction("https://app.example.com"), new ClickByTextAction("New project")));

        TestResult result = finish();
        assertEquals(List.of("Action plan"), names(result.getAttachments()));
        assertEquals(1, attachmentSources.size());
    }

    @Test
    void eachActionBecomesAStepWithItsResult() {
        ActionRunLogger logger = new AllureActionRunLogger(false);
        ActionResult ok = ActionResult.success("click_by_text").method("text-match").detail(ActionResult.TEXT, "Docs").build();

        logger.actionFinished(2, 5, new ClickByTextAction("Docs"), ok);

        StepResult step = finish().getSteps().get(0);
        assertEquals("StateTrail [2/5]: " + new ClickByTextAction("Docs").describe(), step.getName());
        assertEquals(Status.PASSED, step.getStatus());
        assertEquals(List.of("Action result"), names(step.getAttachments()));
        assertTrue(step.getSteps().isEmpty());
    }

    @Test
    void failedActionAddsFailedSubStep() {
        ActionRunLogger logger = new AllureActionRunLogger(false);
        ActionResult failed = ActionResult.failure("click_submit", "No submit button found").build();

        logger.actionFinished(1, 1, new ClickByTextAction("Save"), failed);

        StepResult sub = finish().getSteps().get(0).getSteps().get(0);
        assertEquals("No submit button found", sub.getName());
        assertEquals(Status.FAILED, sub.getStatus());
    }

    @Test
    void loginCheckpointAttachesAuthState() {
        ActionRunLogger logger = new AllureActionRunLogger(true);

        logger.loginCheckpoint(new AuthState(true, true, null, true, true, "https://app.example.com/login"));

        StepResult step = finish().getSteps().get(0);
        assertEquals("Login checkpoint at https://app.example.com/login", step.getName());
        assertEquals(List.of("Auth state"), names(step.getAttachments()));
    }

    @Test
    void factoryAttachesScreenshotsByDefault() {
        assertTrue(((AllureActionRunLogger) StateTrailAllureLoggers.runSteps()).isAttachScreenshots());
        assertFalse(((AllureActionRunLogger) StateTrailAllureLoggers.runSteps(false)).isAttachScreenshots());
    }
}
