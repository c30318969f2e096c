package io.hearthwarrio.statetrail.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Every wait the engine performs, in milliseconds.
 * <p>
 * Apart from the login checkpoint, each wait carries one of these bounds; expiry fails the current tier,
 * never the run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Timeouts {

    @JsonProperty("navigation")
    private long navigationMs = 30_000;

    @JsonProperty("click")
    private long clickMs = 10_000;

    @JsonProperty("probe")
    private long probeMs = 2_000;

    @JsonProperty("login_probe")
    private long loginProbeMs = 1_000;

    @JsonProperty("quick_probe")
    private long quickProbeMs = 500;

    @JsonProperty("modal_probe")
    private long modalProbeMs = 2_000;

    @JsonProperty("network_idle")
    private long networkIdleMs = 3_000;

    @JsonProperty("dom_ready")
    private long domReadyMs = 10_000;

    @JsonProperty("settle_after_goto")
    private long settleAfterGotoMs = 5_000;

    @JsonProperty("settle_after_ready")
    private long settleAfterReadyMs = 2_000;

    @JsonProperty("settle_after_login")
    private long settleAfterLoginMs = 3_000;

    @JsonProperty("settle_after_action")
    private long settleAfterActionMs = 1_000;

    @JsonProperty("settle_before_capture")
    private long settleBeforeCaptureMs = 500;

    @JsonProperty("after_scroll")
    private long afterScrollMs = 300;

    public Timeouts() {
    }

    public static Timeouts defaults() {
        return new Timeouts();
    }

    /**
     * All waits zero. Probes make exactly one attempt and pauses return immediately.
     */
    public static Timeouts immediate() {
        Timeouts t = new Timeouts();
        t.navigationMs = 0;
        t.clickMs = 0;
        t.probeMs = 0;
        t.loginProbeMs = 0;
        t.quickProbeMs = 0;
        t.modalProbeMs = 0;
        t.networkIdleMs = 0;
        t.domReadyMs = 0;
        t.settleAfterGotoMs = 0;
        t.settleAfterReadyMs = 0;
        t.settleAfterLoginMs = 0;
        t.settleAfterActionMs = 0;
        t.settleBeforeCaptureMs = 0;
        t.afterScrollMs = 0;
        return t;
    }

    public Duration navigation() {
        return Duration.ofMillis(navigationMs);
    }

    public Duration click() {
        return Duration.ofMillis(clickMs);
    }

    public Duration probe() {
        return Duration.ofMillis(probeMs);
    }

    public Duration loginProbe() {
        return Duration.ofMillis(loginProbeMs);
    }

    public Duration quickProbe() {
        return Duration.ofMillis(quickProbeMs);
    }

    public Duration modalProbe() {
        return Duration.ofMillis(modalProbeMs);
    }

    public Duration networkIdle() {
        return Duration.ofMillis(networkIdleMs);
    }

    public Duration domReady() {
        return Duration.ofMillis(domReadyMs);
    }

    public Duration settleAfterGoto() {
        return Duration.ofMillis(settleAfterGotoMs);
    }

    public Duration settleAfterReady() {
        return Duration.ofMillis(settleAfterReadyMs);
    }

    public Duration settleAfterLogin() {
        return Duration.ofMillis(settleAfterLoginMs);
    }

    public Duration settleAfterAction() {
        return Duration.ofMillis(settleAfterActionMs);
    }

    public Duration settleBeforeCapture() {
        return Duration.ofMillis(settleBeforeCaptureMs);
    }

    public Duration afterScroll() {
        return Duration.ofMillis(afterScrollMs);
    }

    public Timeouts withNavigation(Duration d) {
        this.navigationMs = d.toMillis();
        return this;
    }

    public Timeouts withClick(Duration d) {
        this.clickMs = d.toMillis();
        return this;
    }

    public Timeouts withProbe(Duration d) {
        this.probeMs = d.toMillis();
        return this;
    }

    public Timeouts withNetworkIdle(Duration d) {
        this.networkIdleMs = d.toMillis();
        return this;
    }
}
