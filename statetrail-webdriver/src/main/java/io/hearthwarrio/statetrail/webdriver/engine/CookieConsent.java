package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.webdriver.Locators;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSettler;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dismisses a cookie-consent banner if one is showing, so it does not cover the fields being filled.
 */
public class CookieConsent {

    private static final Logger log = LoggerFactory.getLogger(CookieConsent.class);

    static final List<By> ACCEPT_BUTTONS = List.of(
            Locators.roleButton("Accept", false),
            Locators.roleButton("I agree", false),
            Locators.roleButton("Accept all", false),
            By.cssSelector("[aria-label*=\"Accept\" i]"),
            By.cssSelector("[aria-label*=\"I agree\" i]"),
            By.cssSelector("button[id*=\"accept\" i]"),
            By.cssSelector("button[class*=\"accept\" i]")
    );

    private final PageProbe probe;
    private final PageSettler settler;
    private final Duration probeTimeout;
    private final Duration afterDismiss;

    public CookieConsent(PageProbe probe, PageSettler settler, Duration probeTimeout, Duration afterDismiss) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.settler = Objects.requireNonNull(settler, "settler must not be null");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        this.afterDismiss = Objects.requireNonNull(afterDismiss, "afterDismiss must not be null");
    }

    /**
     * @return true if a consent button was clicked
     */
    public boolean dismiss() {
        for (By by : ACCEPT_BUTTONS) {
            Optional<WebElement> button = probe.firstVisible(by, probeTimeout);
            if (button.isEmpty()) {
                continue;
            }
            try {
                button.get().click();
                settler.pause(afterDismiss);
                log.debug("Dismissed consent banner via {}", by);
                return true;
            } catch (NoSuchSessionException e) {
                throw e;
            } catch (WebDriverException e) {
                log.debug("Consent button {} not clickable: {}", by, e.getMessage());
            }
        }
        return false;
    }
}
