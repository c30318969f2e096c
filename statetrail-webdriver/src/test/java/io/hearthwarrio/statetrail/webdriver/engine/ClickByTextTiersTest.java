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
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class ClickByTextTiersTest {
    private final ScriptableDriver driver = mock(ScriptableDriver.class);
    private final PageSummaryReader reader = mock(PageSummaryReader.class);
    private List<ResolutionStrategy<ClickRequest>> tiers;

    @BeforeEach
    void setUp() {
        PageProbe probe = new PageProbe(driver, Clock.systemUTC(), duration -> { });
        tiers = ClickByTextTiers.create(probe, new ElementMatcher(), reader, Timeouts.immediate());
    }

    private static WebElement displayed(String text) {
        WebElement e = mock(WebElement.class);
        when(e.isDisplayed()).thenReturn(true);
        when(e.getText()).thenReturn(text);
        return e;
    }

    private Optional<TierOutcome> click(String text) {
        return TierRunner.run(tiers, new ClickRequest(text, TaskContext.none()), t -> true);
    }

    @Test
    void tiersAreTriedInDocumentedOrder() {
        List<String> methods = tiers.stream().map(ResolutionStrategy::method).toList();

        assertEquals(List.of(
                ClickByTextTiers.CONTEXT_AWARE,
                ClickByTextTiers.TEXT_MATCH,
                ClickByTextTiers.ROLE_BUTTON,
                ClickByTextTiers.ROLE_LINK,
                ClickByTextTiers.SIDEBAR,
                ClickByTextTiers.PARTIAL_MATCH
        ), methods);
    }

    @Test
    void visibleTextMatchWinsFirst() {
        WebElement settings = displayed("Settings");
        when(driver.findElements(eq(Locators.textContains("Settings", false)))).thenReturn(List.of(settings));

        TierOutcome outcome = click("Settings").orElseThrow();

        assertEquals(ClickByTextTiers.TEXT_MATCH, outcome.getMethod());
        assertSame(settings, outcome.getTarget().getElement());
    }

    @Test
    void linkIsFoundByRoleWhenTextLookupMisses() {
        WebElement docs = displayed("Docs");
        when(driver.findElements(eq(Locators.roleLink("Docs", false)))).thenReturn(List.of(docs));

        assertEquals(ClickByTextTiers.ROLE_LINK, click("Docs").orElseThrow().getMethod());
    }

    @Test
    void sidebarLookupStaysInsideNavigationContainer() {
        WebElement nav = displayed("");
        WebElement entry = displayed("Members");
        when(driver.findElements(eq(By.cssSelector("aside")))).thenReturn(List.of(nav));
        when(nav.findElements(eq(Locators.textContains("Members", true)))).thenReturn(List.of(entry));

        TierOutcome outcome = click("Members").orElseThrow();

        assertEquals(ClickByTextTiers.SIDEBAR, outcome.getMethod());
        assertSame(entry, outcome.getTarget().getElement());
    }

    @Test
    void partialMatchReportsElementTextForSingleWord() {
        WebElement issues = displayed("Issues (3)");
        when(driver.findElements(eq(ClickByTextTiers.CLICKABLES))).thenReturn(List.of(issues));

        TierOutcome outcome = click("issues").orElseThrow();

        assertEquals(ClickByTextTiers.PARTIAL_MATCH, outcome.getMethod());
        assertEquals("Issues (3)", outcome.getLabel());
    }

    @Test
    void partialMatchIsSkippedForPhrases() {
        WebElement issues = displayed("Open issues (3)");
        when(driver.findElements(eq(ClickByTextTiers.CLICKABLES))).thenReturn(List.of(issues));

        assertTrue(click("open issues now").isEmpty());
    }

    @Test
    void contextTierNeedsTaskAndSectionWord() {
        click("Projects");

        verifyNoInteractions(reader);
    }
}
