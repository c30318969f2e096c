package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.ElementMatcher;
import io.hearthwarrio.statetrail.core.TaskContext;
import io.hearthwarrio.statetrail.core.config.Timeouts;
import io.hearthwarrio.statetrail.webdriver.Locators;
import io.hearthwarrio.statetrail.webdriver.PageProbe;
import io.hearthwarrio.statetrail.webdriver.PageSummaryReader;
import io.hearthwarrio.statetrail.webdriver.ScriptableDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.WebElement;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ClickSubmitTiersTest {
    private final ScriptableDriver driver = mock(ScriptableDriver.class);
    private List<ResolutionStrategy<SubmitRequest>> tiers;

    @BeforeEach
    void setUp() {
        PageProbe probe = new PageProbe(driver, Clock.systemUTC(), duration -> { });
        tiers = ClickSubmitTiers.create(probe, new ElementMatcher(), mock(PageSummaryReader.class), Timeouts.immediate());
    }

    private static WebElement displayed(String text) {
        WebElement e = mock(WebElement.class);
        when(e.isDisplayed()).thenReturn(true);
        when(e.getText()).thenReturn(text);
        return e;
    }

    private Optional<TierOutcome> submit(String... texts) {
        return TierRunner.run(tiers, new SubmitRequest(List.of(texts), TaskContext.none()), t -> true);
    }

    @Test
    void filledSearchFieldIsSubmittedWithEnter() {
        WebElement q = displayed("");
        when(q.getAttribute("value")).thenReturn("selenium grid");
        when(driver.findElements(eq(By.cssSelector("input[name=\"q\"]")))).thenReturn(List.of(q));

        TierOutcome outcome = submit("Search").orElseThrow();

        assertEquals(ClickSubmitTiers.SEARCH_ENTER, outcome.getMethod());
        assertEquals("Enter key (search)", outcome.getLabel());
        assertTrue(outcome.getTarget().isSubmitByEnter());
    }

    @Test
    void emptyUnfocusedSearchFieldIsNotSubmitted() {
        WebElement q = displayed("");
        when(driver.findElements(eq(By.cssSelector("input[name=\"q\"]")))).thenReturn(List.of(q));
        WebElement save = displayed("Save");
        when(driver.findElements(eq(ClickSubmitTiers.FORM_BUTTONS))).thenReturn(List.of(save));

        TierOutcome outcome = submit("Save").orElseThrow();

        assertEquals(ClickSubmitTiers.FORM_CONTEXT, outcome.getMethod());
        assertFalse(outcome.getTarget().isSubmitByEnter());
    }

    @Test
    void formButtonInsideHeaderIsSkipped() {
        WebElement headerSave = displayed("Save search");
        when(headerSave.findElements(eq(Locators.HEADER_OR_SEARCH_ANCESTOR))).thenReturn(List.of(mock(WebElement.class)));
        WebElement formSave = displayed("Save changes");
        when(driver.findElements(eq(ClickSubmitTiers.FORM_BUTTONS))).thenReturn(List.of(headerSave, formSave));

        TierOutcome outcome = submit("Save").orElseThrow();

        assertSame(formSave, outcome.getTarget().getElement());
        assertEquals("Save", outcome.getLabel());
    }

    @Test
    void exactMatchReportsItsOwnMethod() {
        WebElement confirm = displayed("Confirm");
        when(driver.findElements(eq(Locators.roleButtonExact("Confirm")))).thenReturn(List.of(confirm));

        assertEquals(ClickSubmitTiers.EXACT_MATCH, submit("Confirm").orElseThrow().getMethod());
    }

    @Test
    void modalKeywordTierSkipsDismissButtons() {
        WebElement dialog = displayed("");
        WebElement close = displayed("Close without adding");
        WebElement add = displayed("Add member");
        when(driver.findElements(eq(By.cssSelector("[role=\"dialog\"]")))).thenReturn(List.of(dialog));
        when(driver.findElements(eq(ClickSubmitTiers.MODAL_KEYWORD_BUTTONS))).thenReturn(List.of(close, add));

        TierOutcome outcome = submit().orElseThrow();

        assertEquals(ClickSubmitTiers.MODAL_KEYWORD, outcome.getMethod());
        assertEquals("Add member", outcome.getLabel());
    }

    @Test
    void keywordMatchFallsBackToHeaderButtons() {
        WebElement headerNew = displayed("New repository");
        when(headerNew.findElements(eq(Locators.HEADER_OR_SEARCH_ANCESTOR))).thenReturn(List.of(mock(WebElement.class)));
        when(driver.findElements(eq(ClickSubmitTiers.KEYWORD_BUTTONS))).thenReturn(List.of(headerNew));

        TierOutcome outcome = submit().orElseThrow();

        assertEquals(ClickSubmitTiers.KEYWORD_MATCH_FALLBACK, outcome.getMethod());
        assertEquals("New repository", outcome.getLabel());
    }

    @Test
    void submitInputIsLastResort() {
        WebElement input = displayed("");
        when(driver.findElements(eq(ClickSubmitTiers.SUBMIT_TYPES))).thenReturn(List.of(input));

        TierOutcome outcome = submit("Go").orElseThrow();

        assertEquals(ClickSubmitTiers.SUBMIT_TYPE, outcome.getMethod());
        assertEquals("submit button", outcome.getLabel());
    }

    @Test
    void nothingOnPageMeansNoTarget() {
        assertTrue(submit("Save").isEmpty());
    }
}
