package io.hearthwarrio.statetrail.webdriver.engine;

import org.openqa.selenium.WebElement;

import java.util.Objects;

/**
 * Element located by a resolution tier, with the label reported in the action result.
 */
public final class ResolvedTarget {

    private final WebElement element;
    private final String label;
    private final String method;
    private final boolean submitByEnter;

    private ResolvedTarget(WebElement element, String label, String method, boolean submitByEnter) {
        this.element = Objects.requireNonNull(element, "element must not be null");
        this.label = label == null ? "" : label;
        this.method = method;
        this.submitByEnter = submitByEnter;
    }

    public static ResolvedTarget of(WebElement element, String label) {
        return new ResolvedTarget(element, label, null, false);
    }

    /**
     * Target reported under a more specific method name than the tier that produced it.
     */
    public static ResolvedTarget of(WebElement element, String label, String method) {
        return new ResolvedTarget(element, label, method, false);
    }

    /**
     * Target that is submitted by pressing Enter in it rather than clicking it.
     */
    public static ResolvedTarget enterKey(WebElement element, String label) {
        return new ResolvedTarget(element, label, null, true);
    }

    public WebElement getElement() {
        return element;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return method override, or null to report the tier's own method
     */
    public String getMethod() {
        return method;
    }

    public boolean isSubmitByEnter() {
        return submitByEnter;
    }

    @Override
    public String toString() {
        return "ResolvedTarget{label='" + label + "'" +
                (method == null ? "" : ", method='" + method + "'") +
                (submitByEnter ? ", enter" : "") +
                '}';
    }
}
