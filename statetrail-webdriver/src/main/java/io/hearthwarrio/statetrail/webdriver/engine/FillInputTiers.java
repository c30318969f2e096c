package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.ElementMatcher;
import io.hearthwarrio.statetrail.core.FieldSynonymClass;
import io.hearthwarrio.statetrail.core.InputField;
import io.hearthwarrio.statetrail.core.Texts;
import io.hearthwarrio.statetrail.core.config.Timeouts;
import io.hearthwarrio.statetrail.webdriver.Locators;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSummaryReader;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Resolution tiers for one field of {@code fill_inputs}, in the order they are tried.
 */
public final class FillInputTiers {

    public static final String CONTEXT_AWARE = "context-aware";
    public static final String CODE_EDITOR = "code-editor";
    public static final String SEARCH = "search";
    public static final String LABEL = "label";
    public static final String PLACEHOLDER = "placeholder";
    public static final String NAME_CONTAINS = "name-contains";
    public static final String ID_CONTAINS = "id-contains";
    public static final String ANY_TEXT_INPUT = "any-text-input";

    static final List<By> CODE_EDITOR_FIELDS = Locators.css(List.of(
            "[contenteditable=\"true\"]",
            "textarea[class*=\"editor\" i]",
            "textarea[class*=\"code\" i]",
            "div[class*=\"editor\" i][contenteditable]",
            "div[class*=\"code\" i][contenteditable]",
            "textarea",
            "[role=\"textbox\"]"
    ));

    static final List<By> SEARCH_FIELDS = Locators.css(List.of(
            "input[name=\"q\"]",
            "input[name=\"search\"]",
            "input[name=\"search_query\"]",
            "textarea[name=\"q\"]",
            "textarea[name=\"search\"]",
            "input[type=\"search\"]",
            "input[aria-label*=\"Search\" i]",
            "input[aria-label=\"Search\"]",
            "input[placeholder*=\"Search\" i]",
            "input[id*=\"search\" i]",
            "textarea[aria-label*=\"Search\" i]",
            "textarea[placeholder*=\"Search\" i]"
    ));

    static final By TEXT_INPUTS = By.cssSelector("input[type=\"text\"], input[type=\"search\"], textarea");

    private FillInputTiers() {
        // utility class
    }

    public static List<ResolutionStrategy<FieldRequest>> create(
            PageProbe probe,
            ElementMatcher matcher,
            PageSummaryReader reader,
            Timeouts timeouts
    ) {
        Duration t = timeouts.probe();
        return List.of(
                ConditionalStrategy.when(r -> r.getTask().isPresent(),
                        ResolutionStrategy.of(CONTEXT_AWARE, r -> contextAware(probe, matcher, reader, t, r))),
                ConditionalStrategy.when(r -> r.getSynonymClass() == FieldSynonymClass.CODE_EDITOR,
                        ResolutionStrategy.of(CODE_EDITOR, r -> firstOf(probe, CODE_EDITOR_FIELDS, t, r))),
                ConditionalStrategy.when(r -> r.getSynonymClass() == FieldSynonymClass.SEARCH,
                        ResolutionStrategy.of(SEARCH, r -> firstOf(probe, SEARCH_FIELDS, t, r))),
                ResolutionStrategy.of(LABEL, r -> single(probe, Locators.labelledControl(r.getFieldName()), t, r)),
                ResolutionStrategy.of(PLACEHOLDER, r -> single(probe, Locators.placeholderContains(r.getFieldName()), t, r)),
                ResolutionStrategy.of(NAME_CONTAINS, r -> single(probe, Locators.attributeContains("name", r.getFieldName()), t, r)),
                ResolutionStrategy.of(ID_CONTAINS, r -> single(probe, Locators.attributeContains("id", r.getFieldName()), t, r)),
                ResolutionStrategy.of(ANY_TEXT_INPUT, r -> single(probe, TEXT_INPUTS, t, r))
        );
    }

    private static Optional<ResolvedTarget> contextAware(
            PageProbe probe, ElementMatcher matcher, PageSummaryReader reader, Duration timeout, FieldRequest r
    ) {
        Optional<InputField> input = matcher.matchInput(reader.read(), r.getFieldName());
        if (input.isEmpty()) {
            return Optional.empty();
        }
        String name = Texts.safe(input.get().getName());
        if (!name.isEmpty()) {
            Optional<ResolvedTarget> byName = single(probe, Locators.nameEquals(name), timeout, r);
            if (byName.isPresent()) {
                return byName;
            }
        }
        // a stale or duplicated name still leaves the matched label to try
        String label = Texts.safe(input.get().getLabel());
        if (!label.isEmpty()) {
            return single(probe, Locators.labelledControl(label), timeout, r);
        }
        return Optional.empty();
    }

    private static Optional<ResolvedTarget> firstOf(PageProbe probe, List<By> locators, Duration timeout, FieldRequest r) {
        for (By by : locators) {
            Optional<ResolvedTarget> hit = single(probe, by, timeout, r);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    private static Optional<ResolvedTarget> single(PageProbe probe, By by, Duration timeout, FieldRequest r) {
        Optional<WebElement> el = probe.firstVisible(by, timeout);
        return el.map(e -> ResolvedTarget.of(e, r.getFieldName()));
    }
}
