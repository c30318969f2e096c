package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.ButtonInfo;
import io.hearthwarrio.statetrail.core.InputField;
import io.hearthwarrio.statetrail.core.NavigationLink;
import io.hearthwarrio.statetrail.core.PageSummary;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps the visible buttons, navigation links and inputs of the current page to a {@link PageSummary}.
 * <p>
 * Scans are capped ({@link #BUTTON_LIMIT}, {@link #NAVIGATION_LIMIT}, {@link #INPUT_LIMIT}) to keep
 * the cost bounded on large pages. Elements that disappear mid-scan are skipped.
 */
public class WebDriverPageSummaryReader implements PageSummaryReader {

    public static final int BUTTON_LIMIT = 50;
    public static final int MODAL_BUTTON_LIMIT = 20;
    public static final int NAVIGATION_LIMIT = 30;
    public static final int INPUT_LIMIT = 30;

    public static final By BUTTONS = By.cssSelector(
            "button, input[type=\"button\"], input[type=\"submit\"], a[role=\"button\"]");

    public static final By INPUTS = By.cssSelector("input, textarea, [contenteditable=\"true\"]");

    /**
     * Link containers, scanned in this order; a link reachable from several containers is reported once.
     */
    public static final List<String> NAVIGATION_SELECTORS = List.of(
            "nav a",
            "[role=\"navigation\"] a",
            "aside a",
            "[class*=\"sidebar\" i] a",
            "[class*=\"menu\" i] a",
            "[class*=\"nav\" i] a"
    );

    private final PageProbe probe;

    public WebDriverPageSummaryReader(PageProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
    }

    @Override
    public PageSummary read() {
        Optional<WebElement> modal = findOpenModal();
        List<WebElement> modalButtons = modal
                .map(m -> probe.visibleElements(m, BUTTONS, MODAL_BUTTON_LIMIT))
                .orElse(List.of());

        return new PageSummary(
                readButtons(modalButtons),
                readNavigation(),
                readInputs(),
                modal.isPresent(),
                currentUrl()
        );
    }

    /**
     * First visible modal-like container, if any.
     */
    public Optional<WebElement> findOpenModal() {
        for (String selector : ModalSelectors.CONTAINERS) {
            List<WebElement> visible = probe.visibleElements(By.cssSelector(selector), 1);
            if (!visible.isEmpty()) {
                return Optional.of(visible.get(0));
            }
        }
        return Optional.empty();
    }

    private List<ButtonInfo> readButtons(List<WebElement> modalButtons) {
        List<ButtonInfo> out = new ArrayList<>();
        Set<WebElement> seen = new HashSet<>();
        for (WebElement element : probe.visibleElements(BUTTONS, BUTTON_LIMIT)) {
            seen.add(element);
            toButton(element, modalButtons.contains(element)).ifPresent(out::add);
        }
        // modal buttons beyond the page-wide cap still count
        for (WebElement element : modalButtons) {
            if (!seen.contains(element)) {
                toButton(element, true).ifPresent(out::add);
            }
        }
        return out;
    }

    private Optional<ButtonInfo> toButton(WebElement element, boolean inModal) {
        String text = probe.text(element);
        String ariaLabel = probe.attribute(element, "aria-label");
        if (text.isEmpty() && ariaLabel.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ButtonInfo(text.isEmpty() ? ariaLabel : text, ariaLabel, inModal));
    }

    private List<NavigationLink> readNavigation() {
        List<NavigationLink> out = new ArrayList<>();
        Set<WebElement> seen = new HashSet<>();
        for (String selector : NAVIGATION_SELECTORS) {
            for (WebElement link : probe.visibleElements(By.cssSelector(selector), NAVIGATION_LIMIT)) {
                if (!seen.add(link)) {
                    continue;
                }
                String text = probe.text(link);
                if (!text.isEmpty()) {
                    out.add(new NavigationLink(text));
                }
            }
        }
        return out;
    }

    private List<InputField> readInputs() {
        List<InputField> out = new ArrayList<>();
        for (WebElement input : probe.visibleElements(INPUTS, INPUT_LIMIT)) {
            String type = probe.attribute(input, "type");
            if ("hidden".equalsIgnoreCase(type)) {
                continue;
            }
            out.add(new InputField(
                    type,
                    probe.attribute(input, "name"),
                    probe.attribute(input, "placeholder"),
                    resolveLabel(input)
            ));
        }
        return out;
    }

    private String resolveLabel(WebElement input) {
        String id = probe.attribute(input, "id");
        if (id.isEmpty()) {
            return "";
        }
        for (WebElement label : probe.visibleElements(By.cssSelector("label[for=" + Locators.cssString(id) + "]"), 1)) {
            String t = probe.text(label);
            if (!t.isEmpty()) {
                return t;
            }
        }
        return "";
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
