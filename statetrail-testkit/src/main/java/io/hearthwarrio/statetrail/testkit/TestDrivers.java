package io.hearthwarrio.statetrail.testkit;

import io.hearthwarrio.statetrail.core.config.StateTrailSettings;
import org.openqa.selenium.Capabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;

import java.net.URL;
import java.util.Objects;

/**
 * Minimal WebDriver factory driven by {@link StateTrailSettings}.
 * <p>
 * No implicit wait is set: the engine bounds every lookup with its own explicit timeouts, and an
 * implicit wait would stretch each empty probe.
 */
public final class TestDrivers {

    private TestDrivers() {
        // utility class
    }

    /**
     * Creates a local ChromeDriver with default settings.
     */
    public static WebDriver chrome() {
        return chrome(StateTrailSettings.defaults());
    }

    /**
     * Creates a local ChromeDriver honouring headless mode and the persistent profile directory.
     */
    public static WebDriver chrome(StateTrailSettings settings) {
        return chrome(settings, chromeOptions(settings));
    }

    /**
     * Creates a local ChromeDriver with provided options.
     */
    public static WebDriver chrome(StateTrailSettings settings, ChromeOptions options) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(options, "options must not be null");

        WebDriver driver = new ChromeDriver(options);
        applyDefaults(driver, settings);
        return driver;
    }

    /**
     * Creates a RemoteWebDriver with provided Selenium Grid URL and capabilities.
     */
    public static WebDriver remote(URL remoteUrl, Capabilities capabilities, StateTrailSettings settings) {
        Objects.requireNonNull(remoteUrl, "remoteUrl must not be null");
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        Objects.requireNonNull(settings, "settings must not be null");

        WebDriver driver = new RemoteWebDriver(remoteUrl, capabilities);
        applyDefaults(driver, settings);
        return driver;
    }

    /**
     * Chrome options for the given settings.
     */
    public static ChromeOptions chromeOptions(StateTrailSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        ChromeOptions options = new ChromeOptions();
        options.addArguments("--window-size=1920,1080");
        if (settings.isHeadless()) {
            options.addArguments("--headless=new");
        }
        if (settings.isPersistentContext()) {
            options.addArguments("--user-data-dir=" + settings.getPersistentContextDir().toAbsolutePath());
        }
        return options;
    }

    private static void applyDefaults(WebDriver driver, StateTrailSettings settings) {
        driver.manage().timeouts().pageLoadTimeout(settings.getTimeouts().navigation());
    }
}
