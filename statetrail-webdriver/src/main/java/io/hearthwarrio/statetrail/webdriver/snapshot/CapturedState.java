package io.hearthwarrio.statetrail.webdriver.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Metadata of one captured UI state, as stored next to its screenshot.
 */
@JsonPropertyOrder({"index", "url", "timestamp", "dom_hash", "step", "screenshot"})
public final class CapturedState {

    private final int index;
    private final String url;
    private final String timestamp;
    private final String domHash;
    private final String step;
    private final String screenshot;

    @JsonCreator
    public CapturedState(
            @JsonProperty("index") int index,
            @JsonProperty("url") String url,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("dom_hash") String domHash,
            @JsonProperty("step") String step,
            @JsonProperty("screenshot") String screenshot
    ) {
        this.index = index;
        this.url = url == null ? "" : url;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.domHash = Objects.requireNonNull(domHash, "domHash must not be null");
        this.step = Objects.requireNonNull(step, "step must not be null");
        this.screenshot = Objects.requireNonNull(screenshot, "screenshot must not be null");
    }

    @JsonProperty("index")
    public int getIndex() {
        return index;
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    /**
     * @return capture time, ISO-8601 in UTC
     */
    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("dom_hash")
    public String getDomHash() {
        return domHash;
    }

    @JsonProperty("step")
    public String getStep() {
        return step;
    }

    /**
     * @return screenshot file name, relative to the task directory
     */
    @JsonProperty("screenshot")
    public String getScreenshot() {
        return screenshot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CapturedState)) return false;
        CapturedState that = (CapturedState) o;
        return index == that.index
                && url.equals(that.url)
                && timestamp.equals(that.timestamp)
                && domHash.equals(that.domHash)
                && step.equals(that.step)
                && screenshot.equals(that.screenshot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, url, timestamp, domHash, step, screenshot);
    }

    @Override
    public String toString() {
        return "CapturedState{#" + index + " " + step + " @ " + url + '}';
    }
}
