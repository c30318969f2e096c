package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.ButtonInfo;
import io.hearthwarrio.statetrail.core.ButtonMatch;
import io.hearthwarrio.statetrail.core.ElementMatcher;
import io.hearthwarrio.statetrail.core.Texts;
import io.hearthwarrio.statetrail.core.config.Timeouts;
import io.hearthwarrio.statetrail.webdriver.Locators;
import io.hearthwarrio.statetrail.webdriver.ModalSelectors;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSummaryReader;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolution tiers for {@code click_submit}, in the order they are tried.
 * <p>
 * Most tiers skip buttons inside header, navigation or search chrome so that a page-level search
 * button never wins over the form's own submit.
 */
public final class ClickSubmitTiers {

    public static final String SEARCH_ENTER = "search-enter";
    public static final String CREATE_SPECIFIC = "create-specific";
    public static final String CONTEXT_AWARE = "context-aware";
    public static final String FORM_CONTEXT = "form-context";
    public static final String FILTERED_MATCH = "filtered-match";
    public static final String EXACT_MATCH = "exact-match";
    public static final String PARTIAL_MATCH = "partial-match";
    public static final String MODAL_KEYWORD = "modal-keyword";
    public static final String MODAL_FALLBACK = "modal-fallback";
    public static final String KEYWORD_MATCH = "keyword-match";
    public static final String KEYWORD_MATCH_FALLBACK = "keyword-match-fallback";
    public static final String SUBMIT_TYPE = "submit-type";

    static final List<By> SEARCH_FIELDS = Locators.css(List.of(
            "input[name=\"q\"]",
            "input[name=\"search\"]",
            "input[type=\"search\"]",
            "textarea[name=\"q\"]",
            "textarea[name=\"search\"]",
            "input[aria-label*=\"Search\" i]",
            "input[placeholder*=\"Search\" i]",
            "input[id*=\"search\" i]",
            "input[class*=\"search\" i]",
            "textarea[aria-label*=\"Search\" i]",
            "textarea[placeholder*=\"Search\" i]"
    ));

    static final By FILLED_SEARCH_CANDIDATES = By.cssSelector(
            "input[type=\"search\"], input[name*=\"search\" i], input[name=\"q\"], input[aria-label*=\"Search\" i]");

    static final By CREATE_CANDIDATES = By.cssSelector("button, [role=\"button\"], input[type=\"submit\"]");
    static final By GENERAL_BUTTONS = By.cssSelector("button, input[type=\"button\"], input[type=\"submit\"]");
    static final By FORM_BUTTONS = By.cssSelector(
            "form button, main button, [role=\"main\"] button, [class*=\"form\" i] button, [class*=\"content\" i] button");
    static final By PLAIN_BUTTONS = By.cssSelector("button, [role=\"button\"]");
    static final By MODAL_KEYWORD_BUTTONS = By.cssSelector(ModalSelectors.BUTTONS);
    static final By MODAL_FALLBACK_BUTTONS = By.cssSelector(
            "[role=\"dialog\"] button, .modal button, [class*=\"modal\" i] button");
    static final By KEYWORD_BUTTONS = By.cssSelector(
            "button, input[type=\"button\"], input[type=\"submit\"], a[role=\"button\"]");
    static final By SUBMIT_TYPES = By.cssSelector("input[type=\"submit\"], button[type=\"submit\"]");
    static final By DIALOG = By.cssSelector("[role=\"dialog\"]");

    static final List<String> SUBMIT_KEYWORDS = List.of("Create", "Save", "Submit", "Confirm", "Add", "New");
    static final List<String> DISMISS_WORDS = List.of("cancel", "close", "dismiss", "×");
    static final List<String> MODAL_FALLBACK_SKIP = List.of("cancel", "close", "dismiss", "×", "back");

    static final int SCAN_LIMIT = 50;
    static final int FILLED_SEARCH_LIMIT = 5;

    private ClickSubmitTiers() {
        // utility class
    }

    public static List<ResolutionStrategy<SubmitRequest>> create(
            PageProbe probe,
            ElementMatcher matcher,
            PageSummaryReader reader,
            Timeouts timeouts
    ) {
        Scan scan = new Scan(probe, timeouts);
        return List.of(
                ResolutionStrategy.of(SEARCH_ENTER, r -> scan.searchEnter()),
                ConditionalStrategy.when(r -> r.getTask().mentions("create") || r.getTask().mentions("repository"),
                        ResolutionStrategy.of(CREATE_SPECIFIC, r -> scan.containing(CREATE_CANDIDATES, "create", true, List.of(), null))),
                ConditionalStrategy.when(r -> r.getTask().isPresent(),
                        ResolutionStrategy.of(CONTEXT_AWARE, r -> scan.contextAware(matcher, reader, r))),
                ResolutionStrategy.of(FORM_CONTEXT, scan::candidateTexts),
                ConditionalStrategy.when(r -> scan.modalOpen(),
                        ResolutionStrategy.of(MODAL_KEYWORD, r -> scan.modalKeyword())),
                ConditionalStrategy.when(r -> scan.modalOpen(),
                        ResolutionStrategy.of(MODAL_FALLBACK, r -> scan.anyLabelled(MODAL_FALLBACK_BUTTONS, MODAL_FALLBACK_SKIP))),
                ResolutionStrategy.of(KEYWORD_MATCH, r -> scan.keywordMatch()),
                ResolutionStrategy.of(SUBMIT_TYPE, r -> probe.firstVisible(SUBMIT_TYPES, timeouts.probe())
                        .map(el -> ResolvedTarget.of(el, "submit button")))
        );
    }

    /**
     * Page scans shared by the tiers.
     */
    static final class Scan {

        private final PageProbe probe;
        private final Timeouts timeouts;

        Scan(PageProbe probe, Timeouts timeouts) {
            this.probe = probe;
            this.timeouts = timeouts;
        }

        Optional<ResolvedTarget> searchEnter() {
            for (By by : SEARCH_FIELDS) {
                Optional<WebElement> input = probe.firstVisible(by, timeouts.loginProbe());
                if (input.isPresent() && (hasValue(input.get()) || probe.isFocused(input.get()))) {
                    return Optional.of(ResolvedTarget.enterKey(input.get(), "Enter key (search)"));
                }
            }

            Object active = probe.script("return document.activeElement;");
            if (active instanceof WebElement && probe.isDisplayed((WebElement) active) && isSearchInput((WebElement) active)) {
                return Optional.of(ResolvedTarget.enterKey((WebElement) active, "Enter key (focused search)"));
            }

            for (WebElement input : probe.visibleElements(FILLED_SEARCH_CANDIDATES, FILLED_SEARCH_LIMIT)) {
                if (hasValue(input)) {
                    return Optional.of(ResolvedTarget.enterKey(input, "Enter key (search with value)"));
                }
            }
            return Optional.empty();
        }

        private boolean isSearchInput(WebElement el) {
            String tag = Texts.lower(el.getTagName());
            if (!"input".equals(tag) && !"textarea".equals(tag)) {
                return false;
            }
            return "search".equals(Texts.lower(probe.attribute(el, "type")))
                    || Texts.containsAny(Texts.lower(probe.attribute(el, "name")), "search", "q")
                    || Texts.lower(probe.attribute(el, "id")).contains("search")
                    || Texts.lower(probe.attribute(el, "placeholder")).contains("search")
                    || Texts.lower(probe.attribute(el, "aria-label")).contains("search");
        }

        private boolean hasValue(WebElement el) {
            return !probe.attribute(el, "value").isEmpty();
        }

        Optional<ResolvedTarget> contextAware(ElementMatcher matcher, PageSummaryReader reader, SubmitRequest r) {
            Optional<ButtonMatch> match = matcher.matchButton(reader.read(), r.getTask());
            if (match.isEmpty()) {
                return Optional.empty();
            }
            ButtonInfo button = match.get().getButton();
            String text = !Texts.safe(button.getText()).isBlank() ? button.getText().trim() : Texts.safe(button.getAriaLabel()).trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }

            List<Supplier<Optional<WebElement>>> lookups = new ArrayList<>();
            if (button.isInModal()) {
                lookups.add(() -> firstContaining(MODAL_KEYWORD_BUTTONS, text));
                lookups.add(() -> inDialog(Locators.roleButton(text, true)));
                lookups.add(() -> inDialog(Locators.textContains(text, true)));
            }
            lookups.add(() -> probe.firstVisible(Locators.textContains(text, false), timeouts.probe()));
            lookups.add(() -> probe.firstVisible(Locators.roleButton(text, false), timeouts.probe()));
            lookups.add(() -> firstContaining(GENERAL_BUTTONS, text));

            for (Supplier<Optional<WebElement>> lookup : lookups) {
                Optional<WebElement> el = lookup.get();
                if (el.isPresent()) {
                    return Optional.of(ResolvedTarget.of(el.get(), text));
                }
            }
            return Optional.empty();
        }

        private Optional<WebElement> inDialog(By relative) {
            return probe.firstVisible(DIALOG, timeouts.quickProbe())
                    .flatMap(dialog -> probe.firstVisible(dialog, relative, timeouts.probe()));
        }

        private Optional<WebElement> firstContaining(By by, String text) {
            String needle = Texts.lower(text);
            for (WebElement el : probe.visibleElements(by, SCAN_LIMIT)) {
                if (Texts.lower(probe.text(el)).contains(needle)) {
                    return Optional.of(el);
                }
            }
            return Optional.empty();
        }

        /**
         * Tries each candidate text through the form, filtered, exact and partial lookups before moving
         * on to the next text.
         */
        Optional<ResolvedTarget> candidateTexts(SubmitRequest r) {
            for (String text : r.getCandidateTexts()) {
                if (Texts.safe(text).isBlank()) {
                    continue;
                }
                Optional<ResolvedTarget> hit = containing(FORM_BUTTONS, text, true, List.of(), FORM_CONTEXT)
                        .or(() -> containing(PLAIN_BUTTONS, text, true, List.of(), FILTERED_MATCH))
                        .or(() -> outsideHeader(Locators.roleButtonExact(text), text, EXACT_MATCH))
                        .or(() -> outsideHeader(Locators.roleButton(text, false), text, PARTIAL_MATCH));
                if (hit.isPresent()) {
                    return hit.map(t -> ResolvedTarget.of(t.getElement(), text, t.getMethod()));
                }
            }
            return Optional.empty();
        }

        private Optional<ResolvedTarget> outsideHeader(By by, String label, String method) {
            return probe.firstVisible(by, timeouts.probe())
                    .filter(el -> !probe.isInHeaderOrSearch(el))
                    .map(el -> ResolvedTarget.of(el, label, method));
        }

        /**
         * First visible element under {@code by} whose text contains {@code needle}, labelled with its own text.
         *
         * @param skipHeader ignore elements inside header or search chrome
         * @param skipWords  ignore elements whose text contains any of these
         * @param method     method override, or null for the tier's own
         */
        Optional<ResolvedTarget> containing(By by, String needle, boolean skipHeader, List<String> skipWords, String method) {
            String n = Texts.lower(needle);
            for (WebElement el : probe.visibleElements(by, SCAN_LIMIT)) {
                String label = probe.text(el);
                String lower = Texts.lower(label);
                if (label.isEmpty() || !lower.contains(n) || Texts.containsAny(lower, skipWords)) {
                    continue;
                }
                if (skipHeader && probe.isInHeaderOrSearch(el)) {
                    continue;
                }
                return Optional.of(ResolvedTarget.of(el, label, method));
            }
            return Optional.empty();
        }

        Optional<ResolvedTarget> modalKeyword() {
            for (String keyword : SUBMIT_KEYWORDS) {
                Optional<ResolvedTarget> hit = containing(MODAL_KEYWORD_BUTTONS, keyword, false, DISMISS_WORDS, null);
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        }

        Optional<ResolvedTarget> anyLabelled(By by, List<String> skipWords) {
            for (WebElement el : probe.visibleElements(by, SCAN_LIMIT)) {
                String label = probe.text(el);
                if (!label.isEmpty() && !Texts.containsAny(Texts.lower(label), skipWords)) {
                    return Optional.of(ResolvedTarget.of(el, label));
                }
            }
            return Optional.empty();
        }

        /**
         * Per keyword: a button outside the header first, then any button.
         */
        Optional<ResolvedTarget> keywordMatch() {
            for (String keyword : SUBMIT_KEYWORDS) {
                Optional<ResolvedTarget> hit = containing(KEYWORD_BUTTONS, keyword, true, DISMISS_WORDS, KEYWORD_MATCH)
                        .or(() -> containing(KEYWORD_BUTTONS, keyword, false, DISMISS_WORDS, KEYWORD_MATCH_FALLBACK));
                if (hit.isPresent()) {
                    return hit;
                }
            }
            return Optional.empty();
        }

        boolean modalOpen() {
            for (String selector : ModalSelectors.CONTAINERS) {
                if (!probe.visibleElements(By.cssSelector(selector), 1).isEmpty()) {
                    return true;
                }
            }
            return false;
        }
    }
}
