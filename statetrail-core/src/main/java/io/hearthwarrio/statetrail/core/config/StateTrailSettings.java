package io.hearthwarrio.statetrail.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.hearthwarrio.statetrail.core.LoginCheckpointPolicy;
import io.hearthwarrio.statetrail.core.MatcherWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Run configuration, normally read from {@code statetrail.yaml}.
 * <p>
 * Unknown keys are ignored so the same file can also carry settings for the external planner
 * (for example an {@code llm} block).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StateTrailSettings {

    private static final Logger log = LoggerFactory.getLogger(StateTrailSettings.class);

    public static final String DEFAULTS_RESOURCE = "statetrail-defaults.yaml";

    private static final List<String> DEFAULT_BUTTON_TEXTS = List.of("Create", "New", "Add", "Save", "Submit");

    @JsonProperty("headless")
    private boolean headless = false;

    @JsonProperty("slow_mo")
    private long slowMoMs = 300;

    @JsonProperty("persistent_context")
    private boolean persistentContext = true;

    @JsonProperty("persistent_context_dir")
    private String persistentContextDir = ".browser_context";

    @JsonProperty("dataset_root")
    private String datasetRoot = "dataset";

    @JsonProperty("common_button_text")
    private List<String> commonButtonText = new ArrayList<>(DEFAULT_BUTTON_TEXTS);

    @JsonProperty("auth_precheck")
    private boolean authPrecheck = true;

    @JsonProperty("timeouts")
    private Timeouts timeouts = Timeouts.defaults();

    @JsonProperty("matcher")
    private MatcherWeights matcher = MatcherWeights.defaults();

    @JsonProperty("checkpoint")
    private LoginCheckpointPolicy checkpoint = LoginCheckpointPolicy.defaults();

    public StateTrailSettings() {
    }

    public static StateTrailSettings defaults() {
        return new StateTrailSettings();
    }

    /**
     * Reads settings from a YAML file.
     *
     * @param path YAML file
     * @return settings; keys absent from the file keep their defaults
     * @throws SettingsException if the file is missing or not valid YAML for these settings
     */
    public static StateTrailSettings load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new SettingsException("Settings file not found: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new SettingsException("Cannot read settings file: " + path, e);
        }
    }

    /**
     * Reads settings from a classpath resource.
     */
    public static StateTrailSettings loadResource(String resource) {
        Objects.requireNonNull(resource, "resource must not be null");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = StateTrailSettings.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new SettingsException("Settings resource not found: " + resource);
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new SettingsException("Cannot read settings resource: " + resource, e);
        }
    }

    private static StateTrailSettings read(InputStream in, String source) throws IOException {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false);
        String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        if (content.isBlank()) {
            log.debug("Settings in {} are empty, using defaults", source);
            return defaults();
        }
        StateTrailSettings settings;
        try {
            settings = yaml.readValue(content, StateTrailSettings.class);
        } catch (JacksonException e) {
            throw new SettingsException("Invalid settings in " + source + ": " + e.getOriginalMessage(), e);
        }
        if (settings == null) {
            // comment-only document
            return defaults();
        }
        log.debug("Loaded settings from {}", source);
        return settings.fillMissing();
    }

    private StateTrailSettings fillMissing() {
        if (commonButtonText == null || commonButtonText.isEmpty()) {
            commonButtonText = new ArrayList<>(DEFAULT_BUTTON_TEXTS);
        }
        if (timeouts == null) {
            timeouts = Timeouts.defaults();
        }
        if (matcher == null) {
            matcher = MatcherWeights.defaults();
        }
        if (checkpoint == null) {
            checkpoint = LoginCheckpointPolicy.defaults();
        }
        if (datasetRoot == null || datasetRoot.isBlank()) {
            datasetRoot = "dataset";
        }
        if (persistentContextDir == null || persistentContextDir.isBlank()) {
            persistentContextDir = ".browser_context";
        }
        return this;
    }

    public boolean isHeadless() {
        return headless;
    }

    public Duration getSlowMo() {
        return Duration.ofMillis(Math.max(0, slowMoMs));
    }

    public boolean isPersistentContext() {
        return persistentContext;
    }

    public Path getPersistentContextDir() {
        return Paths.get(persistentContextDir);
    }

    public Path getDatasetRoot() {
        return Paths.get(datasetRoot);
    }

    public List<String> getCommonButtonText() {
        return List.copyOf(commonButtonText);
    }

    public boolean isAuthPrecheck() {
        return authPrecheck;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public MatcherWeights getMatcher() {
        return matcher;
    }

    public LoginCheckpointPolicy getCheckpoint() {
        return checkpoint;
    }

    public StateTrailSettings withHeadless(boolean v) {
        this.headless = v;
        return this;
    }

    public StateTrailSettings withSlowMo(Duration d) {
        this.slowMoMs = d.toMillis();
        return this;
    }

    public StateTrailSettings withPersistentContext(boolean v) {
        this.persistentContext = v;
        return this;
    }

    public StateTrailSettings withPersistentContextDir(Path dir) {
        this.persistentContextDir = dir.toString();
        return this;
    }

    public StateTrailSettings withDatasetRoot(Path root) {
        this.datasetRoot = root.toString();
        return this;
    }

    public StateTrailSettings withCommonButtonText(List<String> texts) {
        this.commonButtonText = new ArrayList<>(texts);
        return this;
    }

    public StateTrailSettings withAuthPrecheck(boolean v) {
        this.authPrecheck = v;
        return this;
    }

    public StateTrailSettings withTimeouts(Timeouts t) {
        this.timeouts = Objects.requireNonNull(t, "timeouts must not be null");
        return this;
    }

    public StateTrailSettings withMatcher(MatcherWeights w) {
        this.matcher = Objects.requireNonNull(w, "matcher must not be null");
        return this;
    }

    public StateTrailSettings withCheckpoint(LoginCheckpointPolicy p) {
        this.checkpoint = Objects.requireNonNull(p, "checkpoint must not be null");
        return this;
    }
}
