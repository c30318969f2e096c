package io.hearthwarrio.statetrail.webdriver.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hearthwarrio.statetrail.core.ContentFingerprint;
import io.hearthwarrio.statetrail.webdriver.ScriptableDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.firefox.HasFullPageScreenshot;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SnapshotStoreTest {
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};
    private static final byte[] FULL_PAGE_PNG = {9, 9, 9};

    interface FullPageDriver extends ScriptableDriver, HasFullPageScreenshot {
    }

    interface CdpDriver extends ScriptableDriver, HasCdp {
    }

    @TempDir
    Path dataset;

    private final ScriptableDriver driver = mock(ScriptableDriver.class);
    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
        store = new SnapshotStore(dataset, "create-a-project", clock);
        when(driver.getCurrentUrl()).thenReturn("https://app.example.com/projects");
        when(driver.getScreenshotAs(OutputType.BYTES)).thenReturn(PNG);
        when(driver.getPageSource()).thenReturn("<html><body>projects</body></html>");
    }

    @Test
    void initialCaptureWritesNumberedPair() throws Exception {
        CaptureOutcome outcome = store.captureInitial(driver);

        assertTrue(outcome.isCaptured());
        assertEquals(1, store.getIndex());
        Path png = dataset.resolve("create-a-project").resolve("001_initial.png");
        Path json = dataset.resolve("create-a-project").resolve("001_initial.json");
        assertEquals(png, outcome.getScreenshotFile());
        assertArrayEquals(PNG, Files.readAllBytes(png));

        JsonNode meta = new ObjectMapper().readTree(json.toFile());
        assertEquals(1, meta.get("index").asInt());
        assertEquals("https://app.example.com/projects", meta.get("url").asText());
        assertEquals("2026-03-01T10:15:30Z", meta.get("timestamp").asText());
        assertEquals("initial", meta.get("step").asText());
        assertEquals("001_initial.png", meta.get("screenshot").asText());
        assertEquals(ContentFingerprint.of("<html><body>projects</body></html>"), meta.get("dom_hash").asText());
    }

    @Test
    void unchangedContentIsSkippedUnlessForced() {
        store.captureInitial(driver);

        CaptureOutcome skipped = store.captureIfChanged(driver, "step_1_wait", false);
        assertEquals(CaptureOutcome.Status.SKIPPED, skipped.getStatus());
        assertEquals(1, store.getIndex());
        assertFalse(Files.exists(store.getTaskDir().resolve("002_step_1_wait.png")));

        CaptureOutcome forced = store.captureIfChanged(driver, "step_2_click", true);
        assertTrue(forced.isCaptured());
        assertEquals(2, store.getIndex());
        assertEquals(forced.getState().getDomHash(), store.getLastHash());
    }

    @Test
    void changedContentIsCapturedWithNextIndex() {
        store.captureInitial(driver);
        when(driver.getPageSource()).thenReturn("<html><body>projects<div role=dialog></div></body></html>");

        CaptureOutcome outcome = store.captureIfChanged(driver, "step_1_click", false);

        assertTrue(outcome.isCaptured());
        assertEquals(2, outcome.getState().getIndex());
        assertTrue(Files.exists(store.getTaskDir().resolve("002_step_1_click.json")));
    }

    @Test
    void failedScreenshotLeavesIndexAndHashUntouched() {
        store.captureInitial(driver);
        String hash = store.getLastHash();
        when(driver.getPageSource()).thenReturn("<html>changed</html>");
        when(driver.getScreenshotAs(OutputType.BYTES)).thenThrow(new WebDriverException("renderer crashed"));

        CaptureOutcome outcome = store.captureIfChanged(driver, "step_1_click", true);

        assertEquals(CaptureOutcome.Status.FAILED, outcome.getStatus());
        assertNotNull(outcome.getError());
        assertEquals(1, store.getIndex());
        assertEquals(hash, store.getLastHash());
        assertFalse(Files.exists(store.getTaskDir().resolve("002_step_1_click.png")));
    }

    @Test
    void missingScreenshotIsAFailure() {
        when(driver.getScreenshotAs(OutputType.BYTES)).thenReturn(null);

        CaptureOutcome outcome = store.captureInitial(driver);

        assertEquals(CaptureOutcome.Status.FAILED, outcome.getStatus());
        assertEquals(0, store.getIndex());
        assertNull(store.getLastHash());
    }

    @Test
    void unreadablePageIsAFailure() {
        when(driver.getPageSource()).thenThrow(new WebDriverException("target frame detached"));

        assertEquals(CaptureOutcome.Status.FAILED, store.captureInitial(driver).getStatus());
        assertEquals(0, store.getIndex());
    }

    @Test
    void lostSessionPropagates() {
        when(driver.getPageSource()).thenThrow(new NoSuchSessionException("closed"));

        assertThrows(NoSuchSessionException.class, () -> store.captureInitial(driver));
    }

    @Test
    void summaryListsCapturedStatesInOrder() throws Exception {
        store.captureInitial(driver);
        when(driver.getPageSource()).thenReturn("<html>second</html>");
        store.captureIfChanged(driver, "step_1_click", false);
        store.captureIfChanged(driver, "step_2_wait", false);

        Path file = store.writeSummary();

        assertEquals(store.getTaskDir().resolve(SnapshotStore.SUMMARY_FILE), file);
        JsonNode summary = new ObjectMapper().readTree(file.toFile());
        assertEquals("create-a-project", summary.get("task_slug").asText());
        assertEquals(2, summary.get("total_states").asInt());
        assertEquals(2, summary.get("states").size());
        assertEquals("step_1_click", summary.get("states").get(1).get("step").asText());
        assertEquals(2, store.summary().getTotalStates());
    }

    @Test
    void fullPageScreenshotIsPreferredOverViewport() throws Exception {
        FullPageDriver firefox = mock(FullPageDriver.class);
        when(firefox.getPageSource()).thenReturn("<html><body>long page</body></html>");
        when(firefox.getScreenshotAs(OutputType.BYTES)).thenReturn(PNG);
        when(firefox.getFullPageScreenshotAs(OutputType.BYTES)).thenReturn(FULL_PAGE_PNG);

        CaptureOutcome outcome = store.captureInitial(firefox);

        assertTrue(outcome.isCaptured());
        assertArrayEquals(FULL_PAGE_PNG, Files.readAllBytes(outcome.getScreenshotFile()));
    }

    @Test
    void chromiumCapturesBeyondViewportThroughDevTools() throws Exception {
        CdpDriver chrome = mock(CdpDriver.class);
        when(chrome.getPageSource()).thenReturn("<html><body>long page</body></html>");
        when(chrome.getScreenshotAs(OutputType.BYTES)).thenReturn(PNG);
        when(chrome.executeCdpCommand(eq("Page.captureScreenshot"), anyMap()))
                .thenReturn(Map.<String, Object>of("data", Base64.getEncoder().encodeToString(FULL_PAGE_PNG)));

        CaptureOutcome outcome = store.captureInitial(chrome);

        assertTrue(outcome.isCaptured());
        assertArrayEquals(FULL_PAGE_PNG, Files.readAllBytes(outcome.getScreenshotFile()));
    }

    @Test
    void failedFullPageCaptureFallsBackToViewport() throws Exception {
        FullPageDriver firefox = mock(FullPageDriver.class);
        when(firefox.getPageSource()).thenReturn("<html><body>long page</body></html>");
        when(firefox.getScreenshotAs(OutputType.BYTES)).thenReturn(PNG);
        when(firefox.getFullPageScreenshotAs(OutputType.BYTES)).thenThrow(new WebDriverException("unsupported"));

        CaptureOutcome outcome = store.captureInitial(firefox);

        assertTrue(outcome.isCaptured());
        assertArrayEquals(PNG, Files.readAllBytes(outcome.getScreenshotFile()));
    }

    @Test
    void unsafeStepLabelStaysInsideTaskDirectory() {
        CaptureOutcome outcome = store.captureIfChanged(driver, "hover/../../escape", true);

        assertTrue(outcome.isCaptured());
        assertEquals(store.getTaskDir(), outcome.getScreenshotFile().getParent());
        assertEquals("001_hoverescape.png", outcome.getScreenshotFile().getFileName().toString());
        assertEquals("hover/../../escape", outcome.getState().getStep());
    }

    @Test
    void stepLabelWithoutWordCharactersUsesFallbackName() {
        CaptureOutcome outcome = store.captureIfChanged(driver, "/..", true);

        assertTrue(outcome.isCaptured());
        assertTrue(Files.exists(store.getTaskDir().resolve("001_step.png")));
    }

    @Test
    void rejectsBlankSlug() {
        assertThrows(IllegalArgumentException.class, () -> new SnapshotStore(dataset, " "));
    }
}
