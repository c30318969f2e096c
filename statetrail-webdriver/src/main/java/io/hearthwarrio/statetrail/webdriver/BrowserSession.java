package io.hearthwarrio.statetrail.webdriver;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one browser session. Closing quits the driver once; later closes are no-ops.
 */
public final class BrowserSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserSession.class);

    private final WebDriver driver;
    private final AtomicBoolean closed = new AtomicBoolean();

    public BrowserSession(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
    }

    public WebDriver getDriver() {
        if (closed.get()) {
            throw new IllegalStateException("Browser session already closed");
        }
        return driver;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser did not quit cleanly: {}", e.getMessage());
        }
    }
}
