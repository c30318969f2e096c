package io.hearthwarrio.statetrail.webdriver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LocatorsTest {

    @Test
    void literalPicksQuoteNotInValue() {
        assertEquals("'save'", Locators.literal("save"));
        assertEquals("\"don't save\"", Locators.literal("don't save"));
    }

    @Test
    void literalConcatenatesWhenBothQuotesPresent() {
        assertEquals("concat('say \"hi\" it', \"'\", 's me')", Locators.literal("say \"hi\" it's me"));
    }

    @Test
    void textLookupIsCaseInsensitiveAndRelativeCapable() {
        String absolute = Locators.textContains("New Project", false).toString();
        String relative = Locators.textContains("New Project", true).toString();

        assertTrue(absolute.contains("'new project'"));
        assertTrue(absolute.contains("By.xpath: //*"));
        assertTrue(relative.contains("By.xpath: .//*"));
    }

    @Test
    void cssValuesAreQuotedAndEscaped() {
        assertEquals("By.cssSelector: input[name=\"a\\\"b\"], textarea[name=\"a\\\"b\"]",
                Locators.nameEquals("a\"b").toString());
    }
}
