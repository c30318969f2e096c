package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSettler;
import org.openqa.selenium.Keys;
import org.openqa.selenium.WebElement;

import java.time.Duration;
import java.util.Objects;

/**
 * Page interactions performed on resolved targets.
 */
public class Interactions {

    private final PageProbe probe;
    private final PageSettler settler;
    private final Duration afterScroll;

    public Interactions(PageProbe probe, PageSettler settler, Duration afterScroll) {
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.settler = Objects.requireNonNull(settler, "settler must not be null");
        this.afterScroll = Objects.requireNonNull(afterScroll, "afterScroll must not be null");
    }

    /**
     * Scrolls the target into view, lets it settle and clicks it if still visible.
     */
    public boolean click(ResolvedTarget target) {
        WebElement element = target.getElement();
        probe.scrollIntoView(element);
        settler.pause(afterScroll);
        if (!probe.isDisplayed(element)) {
            return false;
        }
        element.click();
        return true;
    }

    /**
     * Clicks or presses Enter, depending on how the target wants to be submitted.
     */
    public boolean submit(ResolvedTarget target) {
        if (target.isSubmitByEnter()) {
            target.getElement().sendKeys(Keys.ENTER);
            return true;
        }
        return click(target);
    }

    /**
     * Focuses the field, clears it and types the value.
     */
    public boolean fill(ResolvedTarget target, String value) {
        WebElement element = target.getElement();
        element.click();
        element.clear();
        element.sendKeys(value);
        return true;
    }
}
