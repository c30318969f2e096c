package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.ElementMatcher;
import io.hearthwarrio.statetrail.core.NavigationLink;
import io.hearthwarrio.statetrail.core.Texts;
import io.hearthwarrio.statetrail.core.config.Timeouts;
import io.hearthwarrio.statetrail.webdriver.Locators;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSummaryReader;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolution tiers for {@code click_by_text}, in the order they are tried.
 */
public final class ClickByTextTiers {

    public static final String CONTEXT_AWARE = "context-aware";
    public static final String TEXT_MATCH = "text-match";
    public static final String ROLE_BUTTON = "role-button";
    public static final String ROLE_LINK = "role-link";
    public static final String SIDEBAR = "sidebar";
    public static final String PARTIAL_MATCH = "partial-match";

    /**
     * Section names that are usually reached through the navigation rather than a page button.
     */
    static final Set<String> SECTION_WORDS = Set.of("projects", "issues", "tasks", "pages", "documents");

    static final List<String> SIDEBAR_CONTAINERS = List.of(
            "nav",
            "aside",
            "[role=\"navigation\"]",
            "[class*=\"sidebar\" i]",
            "[class*=\"nav\" i]",
            "[class*=\"menu\" i]"
    );

    static final By CLICKABLES = By.cssSelector("button, a, [role=\"button\"], [role=\"link\"]");
    static final int CLICKABLE_LIMIT = 50;

    private ClickByTextTiers() {
        // utility class
    }

    public static List<ResolutionStrategy<ClickRequest>> create(
            PageProbe probe,
            ElementMatcher matcher,
            PageSummaryReader reader,
            Timeouts timeouts
    ) {
        return List.of(
                ConditionalStrategy.when(
                        r -> r.getTask().isPresent() && SECTION_WORDS.contains(Texts.lower(r.getText()).trim()),
                        ResolutionStrategy.of(CONTEXT_AWARE, r -> contextAware(probe, matcher, reader, timeouts, r))),
                ResolutionStrategy.of(TEXT_MATCH, r -> probe.firstVisible(Locators.textContains(r.getText(), false), timeouts.click())
                        .map(el -> ResolvedTarget.of(el, r.getText()))),
                ResolutionStrategy.of(ROLE_BUTTON, r -> probe.firstVisible(Locators.roleButton(r.getText(), false), timeouts.probe())
                        .map(el -> ResolvedTarget.of(el, r.getText()))),
                ResolutionStrategy.of(ROLE_LINK, r -> probe.firstVisible(Locators.roleLink(r.getText(), false), timeouts.probe())
                        .map(el -> ResolvedTarget.of(el, r.getText()))),
                ResolutionStrategy.of(SIDEBAR, r -> sidebar(probe, timeouts, r)),
                ConditionalStrategy.when(ClickRequest::isSingleWord,
                        ResolutionStrategy.of(PARTIAL_MATCH, r -> partialMatch(probe, r)))
        );
    }

    private static Optional<ResolvedTarget> contextAware(
            PageProbe probe, ElementMatcher matcher, PageSummaryReader reader, Timeouts timeouts, ClickRequest r
    ) {
        Optional<NavigationLink> link = matcher.matchNavigation(reader.read(), r.getTask());
        if (link.isEmpty() || !link.get().getText().trim().equalsIgnoreCase(r.getText().trim())) {
            return Optional.empty();
        }
        String navText = link.get().getText();
        return probe.firstVisible(Locators.roleLink(navText, false), timeouts.click())
                .map(el -> ResolvedTarget.of(el, navText));
    }

    private static Optional<ResolvedTarget> sidebar(PageProbe probe, Timeouts timeouts, ClickRequest r) {
        By text = Locators.textContains(r.getText(), true);
        for (String selector : SIDEBAR_CONTAINERS) {
            Optional<WebElement> container = probe.firstVisible(By.cssSelector(selector), timeouts.quickProbe());
            if (container.isEmpty()) {
                continue;
            }
            Optional<WebElement> hit = probe.firstVisible(container.get(), text, timeouts.probe());
            if (hit.isPresent()) {
                return Optional.of(ResolvedTarget.of(hit.get(), r.getText()));
            }
        }
        return Optional.empty();
    }

    private static Optional<ResolvedTarget> partialMatch(PageProbe probe, ClickRequest r) {
        String needle = Texts.lower(r.getText()).trim();
        for (WebElement el : probe.visibleElements(CLICKABLES, CLICKABLE_LIMIT)) {
            String label = probe.text(el);
            if (!label.isEmpty() && Texts.lower(label).contains(needle)) {
                return Optional.of(ResolvedTarget.of(el, label));
            }
        }
        return Optional.empty();
    }
}
