package io.hearthwarrio.statetrail.webdriver;

import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Pauses and load-state waits.
 * <p>
 * Load-state waits are best effort: they report whether the state was reached and never throw on expiry.
 * Network quiescence is approximated by the resource-timing entry count staying unchanged for
 * {@link #QUIET_WINDOW} after the document finished loading.
 */
public class PageSettler {

    private static final Logger log = LoggerFactory.getLogger(PageSettler.class);

    static final Duration QUIET_WINDOW = Duration.ofMillis(500);

    private static final String LOAD_STATE_SCRIPT =
            "return [document.readyState, (window.performance && performance.getEntriesByType)"
                    + " ? performance.getEntriesByType('resource').length : 0];";

    private final PageProbe probe;

    public PageSettler(PageProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
    }

    /**
     * Sleeps for the given duration.
     *
     * @throws RunCancelledException if the thread is interrupted
     */
    public void pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            probe.getSleeper().sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while waiting " + duration.toMillis() + " ms", e);
        }
    }

    /**
     * Waits until the document is no longer loading (DOMContentLoaded has fired).
     *
     * @return true if reached within the timeout
     */
    public boolean awaitDomReady(Duration timeout) {
        return await(timeout, "dom ready", new LoadCheck() {
            @Override
            public boolean reached(String readyState, long resourceCount) {
                return !"loading".equals(readyState);
            }
        });
    }

    /**
     * Waits until the page is loaded and no new resources started for the quiet window.
     *
     * @return true if reached within the timeout
     */
    public boolean awaitNetworkQuiet(Duration timeout) {
        return await(timeout, "network quiet", new LoadCheck() {
            private long lastCount = -1;
            private Instant lastChange = probe.getClock().instant();

            @Override
            public boolean reached(String readyState, long resourceCount) {
                Instant now = probe.getClock().instant();
                if (resourceCount != lastCount) {
                    lastCount = resourceCount;
                    lastChange = now;
                    return false;
                }
                return "complete".equals(readyState)
                        && !now.isBefore(lastChange.plus(QUIET_WINDOW));
            }
        });
    }

    private boolean await(Duration timeout, String what, LoadCheck check) {
        try {
            Boolean reached = probe.newWait(timeout).until(d -> {
                Object state = probe.script(LOAD_STATE_SCRIPT);
                if (!(state instanceof List<?> values) || values.size() < 2) {
                    // no scripting support: nothing to wait for
                    return Boolean.TRUE;
                }
                String readyState = String.valueOf(values.get(0));
                long count = values.get(1) instanceof Number n ? n.longValue() : 0L;
                return check.reached(readyState, count);
            });
            return Boolean.TRUE.equals(reached);
        } catch (TimeoutException e) {
            log.debug("Page did not reach {} within {} ms", what, timeout.toMillis());
            return false;
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            log.debug("Waiting for {} failed: {}", what, e.getMessage());
            return false;
        }
    }

    private interface LoadCheck {
        boolean reached(String readyState, long resourceCount);
    }
}
