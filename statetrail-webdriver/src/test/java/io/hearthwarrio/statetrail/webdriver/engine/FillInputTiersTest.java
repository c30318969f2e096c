package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.ElementMatcher;
import io.hearthwarrio.statetrail.core.InputField;
import io.hearthwarrio.statetrail.core.PageSummary;
import io.hearthwarrio.statetrail.core.TaskContext;
import io.hearthwarrio.statetrail.core.config.Timeouts;
import io.hearthwarrio.statetrail.webdriver.Locators;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSummaryReader;
import io.hearthwarrio.statetrail.webdriver.ScriptableDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebElement;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class FillInputTiersTest {
    private final ScriptableDriver driver = mock(ScriptableDriver.class);
    private final PageSummaryReader reader = mock(PageSummaryReader.class);
    private List<ResolutionStrategy<FieldRequest>> tiers;

    @BeforeEach
    void setUp() {
        PageProbe probe = new PageProbe(driver, Clock.systemUTC(), duration -> { });
        tiers = FillInputTiers.create(probe, new ElementMatcher(), reader, Timeouts.immediate());
    }

    private static WebElement displayed() {
        WebElement e = mock(WebElement.class);
        when(e.isDisplayed()).thenReturn(true);
        return e;
    }

    private Optional<TierOutcome> fill(String field, TaskContext task) {
        return TierRunner.run(tiers, new FieldRequest(field, "value", task), t -> true);
    }

    private Optional<TierOutcome> fill(String field) {
        return fill(field, TaskContext.none());
    }

    private void pageInputs(InputField... inputs) {
        when(reader.read()).thenReturn(new PageSummary(List.of(), List.of(), List.of(inputs), false, "https://app.example.com"));
    }

    @Test
    void tiersAreTriedInDocumentedOrder() {
        List<String> methods = tiers.stream().map(ResolutionStrategy::method).toList();

        assertEquals(List.of(
                FillInputTiers.CONTEXT_AWARE,
                FillInputTiers.CODE_EDITOR,
                FillInputTiers.SEARCH,
                FillInputTiers.LABEL,
                FillInputTiers.PLACEHOLDER,
                FillInputTiers.NAME_CONTAINS,
                FillInputTiers.ID_CONTAINS,
                FillInputTiers.ANY_TEXT_INPUT
        ), methods);
    }

    @Test
    void codeFieldGoesToContentEditableEditor() {
        WebElement editor = displayed();
        when(driver.findElements(eq(FillInputTiers.CODE_EDITOR_FIELDS.get(0)))).thenReturn(List.of(editor));

        TierOutcome outcome = fill("code").orElseThrow();

        assertEquals(FillInputTiers.CODE_EDITOR, outcome.getMethod());
        assertSame(editor, outcome.getTarget().getElement());
    }

    @Test
    void searchFieldUsesSearchSelectors() {
        WebElement q = displayed();
        when(driver.findElements(eq(FillInputTiers.SEARCH_FIELDS.get(0)))).thenReturn(List.of(q));

        TierOutcome outcome = fill("query").orElseThrow();

        assertEquals(FillInputTiers.SEARCH, outcome.getMethod());
        assertSame(q, outcome.getTarget().getElement());
    }

    @Test
    void labelIsTriedBeforePlaceholder() {
        WebElement byLabel = displayed();
        WebElement byPlaceholder = displayed();
        when(driver.findElements(eq(Locators.labelledControl("Email")))).thenReturn(List.of(byLabel));
        when(driver.findElements(eq(Locators.placeholderContains("Email")))).thenReturn(List.of(byPlaceholder));

        TierOutcome outcome = fill("Email").orElseThrow();

        assertEquals(FillInputTiers.LABEL, outcome.getMethod());
        assertSame(byLabel, outcome.getTarget().getElement());
    }

    @Test
    void placeholderIsUsedWhenNoLabelMatches() {
        WebElement input = displayed();
        when(driver.findElements(eq(Locators.placeholderContains("Email")))).thenReturn(List.of(input));

        assertEquals(FillInputTiers.PLACEHOLDER, fill("Email").orElseThrow().getMethod());
    }

    @Test
    void nameAttributeIsUsedAfterPlaceholder() {
        WebElement input = displayed();
        when(driver.findElements(eq(Locators.attributeContains("name", "title")))).thenReturn(List.of(input));

        assertEquals(FillInputTiers.NAME_CONTAINS, fill("title").orElseThrow().getMethod());
    }

    @Test
    void idAttributeIsUsedAfterName() {
        WebElement input = displayed();
        when(driver.findElements(eq(Locators.attributeContains("id", "title")))).thenReturn(List.of(input));

        assertEquals(FillInputTiers.ID_CONTAINS, fill("title").orElseThrow().getMethod());
    }

    @Test
    void anyTextInputIsTheLastResort() {
        WebElement input = displayed();
        when(driver.findElements(eq(FillInputTiers.TEXT_INPUTS))).thenReturn(List.of(input));

        TierOutcome outcome = fill("Project name").orElseThrow();

        assertEquals(FillInputTiers.ANY_TEXT_INPUT, outcome.getMethod());
        assertEquals("Project name", outcome.getLabel());
    }

    @Test
    void nothingOnThePageResolvesNothing() {
        assertTrue(fill("Email").isEmpty());
    }

    @Test
    void contextAwareTierIsSkippedWithoutTask() {
        WebElement input = displayed();
        when(driver.findElements(eq(FillInputTiers.TEXT_INPUTS))).thenReturn(List.of(input));

        fill("Email");

        verifyNoInteractions(reader);
    }

    @Test
    void contextAwareTierUsesMatchedInputName() {
        pageInputs(new InputField("email", "user_email", "you@example.com", "Email"));
        WebElement input = displayed();
        when(driver.findElements(eq(Locators.nameEquals("user_email")))).thenReturn(List.of(input));

        TierOutcome outcome = fill("Email", TaskContext.of("Sign up for the newsletter")).orElseThrow();

        assertEquals(FillInputTiers.CONTEXT_AWARE, outcome.getMethod());
        assertSame(input, outcome.getTarget().getElement());
    }

    @Test
    void contextAwareTierFallsBackToLabelWhenNameLookupMisses() {
        pageInputs(new InputField("text", "stale_name", "", "Project title"));
        WebElement input = displayed();
        when(driver.findElements(eq(Locators.labelledControl("Project title")))).thenReturn(List.of(input));

        TierOutcome outcome = fill("Project title", TaskContext.of("Create a project")).orElseThrow();

        assertEquals(FillInputTiers.CONTEXT_AWARE, outcome.getMethod());
        assertSame(input, outcome.getTarget().getElement());
    }
}
