package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.AuthSignals;
import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.core.AuthStateClassifier;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads login signals from the live page and classifies them.
 * <p>
 * Login buttons are probed in three tiers, each probe bounded by the login probe timeout:
 * <ol>
 *   <li>literal phrase as button name, then as any element text</li>
 *   <li>aria-label substrings</li>
 *   <li>class and id substrings</li>
 * </ol>
 */
public class AuthStateDetector {

    private static final Logger log = LoggerFactory.getLogger(AuthStateDetector.class);

    static final By EMAIL_FIELDS = By.cssSelector(
            "input[type=\"email\"], input[name*=\"email\" i], input[id*=\"email\" i]");

    static final By PASSWORD_FIELDS = By.cssSelector("input[type=\"password\"]");

    static final List<String> LOGIN_PHRASES = List.of(
            "sign in", "log in", "login", "signin",
            "sign in with google", "continue with google",
            "get started", "sign up", "signup"
    );

    static final List<String> LOGIN_ARIA_SELECTORS = List.of(
            "button[aria-label*=\"sign in\" i]",
            "button[aria-label*=\"log in\" i]",
            "a[aria-label*=\"sign in\" i]",
            "button[aria-label*=\"login\" i]"
    );

    static final List<String> LOGIN_CLASS_SELECTORS = List.of(
            "button[class*=\"sign-in\" i]",
            "button[class*=\"login\" i]",
            "a[class*=\"sign-in\" i]",
            "button[id*=\"sign-in\" i]",
            "button[id*=\"login\" i]"
    );

    static final String ARIA_LABEL_BUTTON = "login button (aria-label)";
    static final String CLASS_ID_BUTTON = "login button (class/id)";

    private final PageProbe probe;
    private final Duration probeTimeout;
    private final AuthStateClassifier classifier;

    public AuthStateDetector(PageProbe probe, Duration probeTimeout) {
        this(probe, probeTimeout, new AuthStateClassifier());
    }

    public AuthStateDetector(PageProbe probe, Duration probeTimeout, AuthStateClassifier classifier) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    public AuthState detect() {
        AuthSignals signals = new AuthSignals(
                currentUrl(),
                probe.count(EMAIL_FIELDS) > 0,
                probe.count(PASSWORD_FIELDS) > 0,
                findLoginButton().orElse(null)
        );
        AuthState state = classifier.classify(signals);
        log.debug("Auth signals {} -> {}", signals, state);
        return state;
    }

    /**
     * @return description of the first visible login affordance
     */
    Optional<String> findLoginButton() {
        for (String phrase : LOGIN_PHRASES) {
            if (probe.firstVisible(Locators.roleButton(phrase, false), probeTimeout).isPresent()
                    || probe.firstVisible(Locators.textContains(phrase, false), probeTimeout).isPresent()) {
                return Optional.of(phrase);
            }
        }
        if (anyVisible(LOGIN_ARIA_SELECTORS)) {
            return Optional.of(ARIA_LABEL_BUTTON);
        }
        if (anyVisible(LOGIN_CLASS_SELECTORS)) {
            return Optional.of(CLASS_ID_BUTTON);
        }
        return Optional.empty();
    }

    private boolean anyVisible(List<String> selectors) {
        for (String selector : selectors) {
            if (probe.firstVisible(By.cssSelector(selector), probeTimeout).isPresent()) {
                return true;
            }
        }
        return false;
    }

    private String currentUrl() {
        try {
            String url = probe.getDriver().getCurrentUrl();
            return url == null ? "" : url;
        } catch (NoSuchSessionException e) {
            throw e;
        } catch (WebDriverException e) {
            return "";
        }
    }
}
