package io.hearthwarrio.statetrail.webdriver;

import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.Sleeper;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded-time visibility probes and small element helpers over a live page.
 * <p>
 * Every probe blocks for at most its own timeout. A timeout, a missing element or a rejected selector
 * all come back as "not found"; only a lost session propagates.
 * <p>
 * This class is not thread-safe and is expected to be used from the single run thread.
 */
public class PageProbe {

    private static final Logger log = LoggerFactory.getLogger(PageProbe.class);

    private static final Duration POLL = Duration.ofMillis(100);

    private final WebDriver driver;
    private final Clock clock;
    private final Sleeper sleeper;

    public PageProbe(WebDriver driver) {
        this(driver, Clock.systemDefaultZone(), Sleeper.SYSTEM_SLEEPER);
    }

    public PageProbe(WebDriver driver, Clock clock, Sleeper sleeper) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    public WebDriver getDriver() {
        return driver;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Waits for the first displayed element matching {@code by} on the page.
     */
    public Optional<WebElement> firstVisible(By by, Duration timeout) {
        return firstVisible(driver, by, timeout);
    }

    /**
     * Waits for the first displayed element matching {@code by} under {@code root}.
     *
     * @param root    page or container element
     * @param by      locator
     * @param timeout upper bound; zero means a single attempt
     * @return visible element or empty
     */
    public Optional<WebElement> firstVisible(SearchContext root, By by, Duration timeout) {
        try {
            return Optional.ofNullable(newWait(timeout).until(d -> firstDisplayed(root.findElements(by))));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            log.debug("Probe {} failed: {}", by, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns the first {@code limit} matches that are displayed right now (no waiting).
     */
    public List<WebElement> visibleElements(SearchContext root, By by, int limit) {
        List<WebElement> found;
        try {
            found = root.findElements(by);
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            log.debug("Lookup {} failed: {}", by, e.getMessage());
            return Collections.emptyList();
        }
        if (found == null || found.isEmpty()) {
            return Collections.emptyList();
        }
        List<WebElement> out = new ArrayList<>();
        int n = Math.min(found.size(), limit);
        for (int i = 0; i < n; i++) {
            WebElement e = found.get(i);
            if (isDisplayed(e)) {
                out.add(e);
            }
        }
        return out;
    }

    public List<WebElement> visibleElements(By by, int limit) {
        return visibleElements(driver, by, limit);
    }

    /**
     * Count of matches regardless of visibility.
     */
    public int count(By by) {
        try {
            List<WebElement> found = driver.findElements(by);
            return found == null ? 0 : found.size();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return 0;
        }
    }

    public boolean isDisplayed(WebElement element) {
        try {
            return element != null && element.isDisplayed();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return false;
        }
    }

    /**
     * Visible text of an element; for inputs falls back to their value. Never null.
     */
    public String text(WebElement element) {
        try {
            String t = element.getText();
            if (t != null && !t.isBlank()) {
                return t.trim();
            }
            if ("input".equalsIgnoreCase(element.getTagName())) {
                return attribute(element, "value");
            }
            return "";
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return "";
        }
    }

    public String attribute(WebElement element, String name) {
        try {
            String v = element.getAttribute(name);
            return v == null ? "" : v.trim();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return "";
        }
    }

    /**
     * Whether the element sits inside header, navigation, banner or search chrome.
     */
    public boolean isInHeaderOrSearch(WebElement element) {
        try {
            List<WebElement> ancestors = element.findElements(Locators.HEADER_OR_SEARCH_ANCESTOR);
            return ancestors != null && !ancestors.isEmpty();
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return false;
        }
    }

    public boolean isFocused(WebElement element) {
        Object v = script("return document.activeElement === arguments[0];", element);
        return Boolean.TRUE.equals(v);
    }

    public void scrollIntoView(WebElement element) {
        script("arguments[0].scrollIntoView({block: 'center', inline: 'nearest'});", element);
    }

    /**
     * Runs a script when the driver supports it.
     *
     * @return script result, or null when scripting is unavailable or the script failed
     */
    public Object script(String js, Object... args) {
        if (!(driver instanceof JavascriptExecutor)) {
            return null;
        }
        try {
            return ((JavascriptExecutor) driver).executeScript(js, args);
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            log.debug("Script failed: {}", e.getMessage());
            return null;
        }
    }

    WebDriverWait newWait(Duration timeout) {
        Duration t = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
        WebDriverWait wait = new WebDriverWait(driver, t, POLL, clock, sleeper);
        wait.ignoring(StaleElementReferenceException.class);
        return wait;
    }

    private WebElement firstDisplayed(List<WebElement> elements) {
        if (elements == null) {
            return null;
        }
        for (WebElement e : elements) {
            try {
                if (e.isDisplayed()) {
                    return e;
                }
            } catch (StaleElementReferenceException ignored) {
                // re-rendered between lookup and check
            }
        }
        return null;
    }
}
