package io.hearthwarrio.statetrail.allure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.hearthwarrio.statetrail.core.ActionResult;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.action.Action;
import io.hearthwarrio.statetrail.webdriver.ActionRunLogger;
import io.hearthwarrio.statetrail.webdriver.snapshot.CaptureOutcome;
import io.hearthwarrio.statetrail.webdriver.snapshot.CapturedState;
import io.qameta.allure.Allure;
import io.qameta.allure.model.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Allure run logger: one step per executed action with the result attached, and one step per
 * captured state with its screenshot and metadata.
 * <p>
 * Lives in statetrail-allure to avoid leaking the Allure dependency into core/webdriver.
 */
public final class AllureActionRunLogger implements ActionRunLogger {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean attachScreenshots;

    public AllureActionRunLogger(boolean attachScreenshots) {
        this.attachScreenshots = attachScreenshots;
    }

    public boolean isAttachScreenshots() {
        return attachScreenshots;
    }

    @Override
    public void planReady(List<Action> actions) {
        StringBuilder sb = new StringBuilder(256);
        for (int i = 0; i < actions.size(); i++) {
            sb.append(i + 1).append(". ").append(actions.get(i).describe()).append('\n');
        }
        Allure.addAttachment("Action plan", "text/plain", sb.toString(), ".txt");
    }

    @Override
    public void actionFinished(int step, int total, Action action, ActionResult result) {
        String title = "StateTrail [" + step + "/" + total + "]: " + action.describe();
        Allure.step(title, () -> {
            Allure.addAttachment("Action result", "application/json", toJson(result), ".json");
            if (!result.isSuccess()) {
                Allure.step(safe(result.getError()), Status.FAILED);
            }
        });
    }

    @Override
    public void stateCaptured(CaptureOutcome outcome) {
        CapturedState state = outcome.getState();
        Allure.step("State " + state.getIndex() + ": " + state.getStep(), () -> {
            Allure.addAttachment("Metadata", "application/json", toJson(state), ".json");
            if (attachScreenshots && outcome.getScreenshotFile() != null) {
                byte[] png = read(outcome.getScreenshotFile());
                Allure.addAttachment("Screenshot", "image/png", new ByteArrayInputStream(png), ".png");
            }
        });
    }

    @Override
    public void captureFailed(CaptureOutcome outcome) {
        String cause = outcome.getError() == null ? "" : ": " + outcome.getError().getMessage();
        Allure.step("Capture failed for " + outcome.getStep() + cause, Status.BROKEN);
    }

    @Override
    public void loginCheckpoint(AuthState state) {
        Allure.step("Login checkpoint at " + state.getUrl(), () ->
                Allure.addAttachment("Auth state", "application/json", toJson(state), ".json"));
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static byte[] read(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read screenshot " + file, e);
        }
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
