package io.hearthwarrio.statetrail.webdriver.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.hearthwarrio.statetrail.core.ContentFingerprint;
import io.hearthwarrio.statetrail.core.Slugs;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chromium.HasCdp;
import org.openqa.selenium.firefox.HasFullPageScreenshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Captures screenshot/metadata pairs for one task, skipping captures whose page content did not change
 * since the previous capture.
 * <p>
 * Records are numbered from 1 in capture order and written as {@code NNN_<step>.png} and
 * {@code NNN_<step>.json} under {@code <datasetRoot>/<taskSlug>}; the step label is slugified before it
 * becomes part of a file name. Screenshots cover the full scrollable page where the driver supports it
 * (Firefox natively, Chromium through the DevTools protocol) and the viewport otherwise. Each file is written to a temporary
 * sibling and moved into place. A failed capture leaves the index and the last fingerprint untouched.
 * <p>
 * Not thread-safe; one store belongs to one run.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    public static final String INITIAL_STEP = "initial";
    public static final String SUMMARY_FILE = "summary.json";

    private static final String FALLBACK_STEP = "step";

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String taskSlug;
    private final Path taskDir;
    private final Clock clock;

    private int index;
    private String lastHash;
    private final List<CapturedState> states = new ArrayList<>();

    public SnapshotStore(Path datasetRoot, String taskSlug) {
        this(datasetRoot, taskSlug, Clock.systemUTC());
    }

    public SnapshotStore(Path datasetRoot, String taskSlug, Clock clock) {
        Objects.requireNonNull(datasetRoot, "datasetRoot must not be null");
        this.taskSlug = Objects.requireNonNull(taskSlug, "taskSlug must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (taskSlug.isBlank()) {
            throw new IllegalArgumentException("taskSlug must not be blank");
        }
        this.taskDir = datasetRoot.resolve(taskSlug);
        try {
            Files.createDirectories(taskDir);
        } catch (IOException e) {
            throw new SnapshotCaptureException("Cannot create snapshot directory " + taskDir, e);
        }
    }

    public Path getTaskDir() {
        return taskDir;
    }

    public String getTaskSlug() {
        return taskSlug;
    }

    /**
     * @return number of states captured so far
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return fingerprint of the last captured page, or null before the first capture
     */
    public String getLastHash() {
        return lastHash;
    }

    public CaptureOutcome captureInitial(WebDriver driver) {
        return captureIfChanged(driver, INITIAL_STEP, true);
    }

    /**
     * Captures the current page unless its content fingerprint equals the last captured one.
     *
     * @param force capture even when the content is unchanged
     * @throws NoSuchSessionException when the browser session is gone
     */
    public CaptureOutcome captureIfChanged(WebDriver driver, String step, boolean force) {
        Objects.requireNonNull(driver, "driver must not be null");
        Objects.requireNonNull(step, "step must not be null");

        String hash;
        try {
            hash = ContentFingerprint.of(driver.getPageSource());
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            log.warn("Could not read page content for '{}': {}", step, e.getMessage());
            return CaptureOutcome.failed(step, e);
        }

        if (!force && hash.equals(lastHash)) {
            log.info("No change detected for: {}", step);
            return CaptureOutcome.skipped(step);
        }

        int next = index + 1;
        String base = String.format("%03d_%s", next, fileLabel(step));
        Path png = taskDir.resolve(base + ".png");
        Path json = taskDir.resolve(base + ".json");

        CapturedState state;
        try {
            byte[] screenshot = screenshot(driver);
            state = new CapturedState(
                    next,
                    driver.getCurrentUrl(),
                    DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock)),
                    hash,
                    step,
                    png.getFileName().toString()
            );
            writeAtomically(png, screenshot);
            try {
                writeAtomically(json, JSON.writeValueAsBytes(state));
            } catch (IOException e) {
                Files.deleteIfExists(png);
                throw e;
            }
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (IOException | WebDriverException | SnapshotCaptureException e) {
            log.warn("Error capturing state '{}': {}", step, e.getMessage());
            return CaptureOutcome.failed(step, e);
        }

        index = next;
        lastHash = hash;
        states.add(state);
        log.info("Captured state {}: {} (hash: {}...)", next, step, hash.substring(0, 16));
        return CaptureOutcome.captured(state, png, json);
    }

    public RunSummary summary() {
        return new RunSummary(taskSlug, index, taskDir.toString(), states);
    }

    /**
     * Writes {@link #summary()} to {@value #SUMMARY_FILE} in the task directory.
     */
    public Path writeSummary() {
        Path target = taskDir.resolve(SUMMARY_FILE);
        try {
            writeAtomically(target, JSON.writeValueAsBytes(summary()));
        } catch (IOException e) {
            throw new SnapshotCaptureException("Cannot write " + target, e);
        }
        return target;
    }

    static String fileLabel(String step) {
        String label = Slugs.slugify(step);
        return label.isEmpty() ? FALLBACK_STEP : label;
    }

    private static byte[] screenshot(WebDriver driver) {
        byte[] fullPage = fullPageScreenshot(driver);
        if (fullPage != null) {
            return fullPage;
        }
        if (!(driver instanceof TakesScreenshot)) {
            throw new SnapshotCaptureException("Driver cannot take screenshots: " + driver.getClass().getName());
        }
        byte[] bytes = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
        if (bytes == null) {
            throw new SnapshotCaptureException("Driver returned no screenshot");
        }
        return bytes;
    }

    /**
     * @return full-page PNG bytes, or null when the driver cannot produce one
     */
    private static byte[] fullPageScreenshot(WebDriver driver) {
        try {
            if (driver instanceof HasFullPageScreenshot) {
                return ((HasFullPageScreenshot) driver).getFullPageScreenshotAs(OutputType.BYTES);
            }
            if (driver instanceof HasCdp) {
                Map<String, Object> result = ((HasCdp) driver).executeCdpCommand(
                        "Page.captureScreenshot",
                        Map.of("format", "png", "captureBeyondViewport", true)
                );
                Object data = result == null ? null : result.get("data");
                return data instanceof String ? Base64.getDecoder().decode((String) data) : null;
            }
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException | IllegalArgumentException e) {
            log.debug("Full-page screenshot unavailable, using viewport: {}", e.getMessage());
        }
        return null;
    }

    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
