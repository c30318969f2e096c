package io.hearthwarrio.statetrail.webdriver;

import org.openqa.selenium.By;

import java.util.List;
import java.util.Locale;

/**
 * Builds Selenium locators for text, role and attribute lookups.
 * <p>
 * Text comparisons are case-insensitive and substring based unless stated otherwise.
 * Each XPath builder takes a {@code relative} flag so the same lookup can run inside a container element.
 */
public final class Locators {

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";

    /**
     * Ancestors that mark header, navigation, banner or search chrome.
     */
    public static final By HEADER_OR_SEARCH_ANCESTOR = By.xpath(
            "./ancestor::header | ./ancestor::nav | ./ancestor::*[@role='banner']"
                    + " | ./ancestor::*[contains(" + lower("@class") + ", 'header')]"
                    + " | ./ancestor::*[contains(" + lower("@class") + ", 'nav')]"
                    + " | ./ancestor::*[contains(" + lower("@class") + ", 'search')]"
    );

    private Locators() {
        // utility class
    }

    /**
     * Elements whose own text contains {@code text}. Script and style content is ignored.
     */
    public static By textContains(String text, boolean relative) {
        String lit = literal(lowerCase(text));
        return By.xpath(prefix(relative)
                + "*[not(self::script or self::style or self::head or self::title)]"
                + "[text()[contains(" + lower("normalize-space(.)") + ", " + lit + ")]]");
    }

    /**
     * Button-like elements (button, role=button, submit/button inputs) whose accessible name contains {@code name}.
     */
    public static By roleButton(String name, boolean relative) {
        String p = prefix(relative);
        String nameMatch = nameContains(name);
        return By.xpath(
                p + "button[" + nameMatch + "]"
                        + " | " + p + "*[@role='button'][" + nameMatch + "]"
                        + " | " + p + "input[(@type='submit' or @type='button') and ("
                        + "contains(" + lower("@value") + ", " + literal(lowerCase(name)) + ")"
                        + " or contains(" + lower("@aria-label") + ", " + literal(lowerCase(name)) + "))]"
        );
    }

    /**
     * Button-like elements whose accessible name equals {@code name}, ignoring case and surrounding space.
     */
    public static By roleButtonExact(String name) {
        String lit = literal(lowerCase(name).trim());
        String nameEq = lower("normalize-space(.)") + " = " + lit + " or " + lower("normalize-space(@aria-label)") + " = " + lit;
        return By.xpath(
                "//button[" + nameEq + "]"
                        + " | //*[@role='button'][" + nameEq + "]"
                        + " | //input[(@type='submit' or @type='button') and " + lower("normalize-space(@value)") + " = " + lit + "]"
        );
    }

    public static By roleLink(String name, boolean relative) {
        String p = prefix(relative);
        String nameMatch = nameContains(name);
        return By.xpath(p + "a[@href][" + nameMatch + "] | " + p + "*[@role='link'][" + nameMatch + "]");
    }

    /**
     * Inputs and textareas associated with a label containing {@code label} (via {@code for}, nesting
     * or {@code aria-label}).
     */
    public static By labelledControl(String label) {
        String lit = literal(lowerCase(label));
        String labelMatch = "label[contains(" + lower("normalize-space(.)") + ", " + lit + ")]";
        return By.xpath(
                "//input[@id = //" + labelMatch + "/@for]"
                        + " | //textarea[@id = //" + labelMatch + "/@for]"
                        + " | //" + labelMatch + "//input"
                        + " | //" + labelMatch + "//textarea"
                        + " | //input[contains(" + lower("@aria-label") + ", " + lit + ")]"
                        + " | //textarea[contains(" + lower("@aria-label") + ", " + lit + ")]"
        );
    }

    public static By placeholderContains(String placeholder) {
        String lit = literal(lowerCase(placeholder));
        return By.xpath(
                "//input[contains(" + lower("@placeholder") + ", " + lit + ")]"
                        + " | //textarea[contains(" + lower("@placeholder") + ", " + lit + ")]"
        );
    }

    /**
     * Inputs and textareas whose {@code attribute} contains {@code value}, case-insensitive.
     */
    public static By attributeContains(String attribute, String value) {
        String v = cssString(value);
        return By.cssSelector("input[" + attribute + "*=" + v + " i], textarea[" + attribute + "*=" + v + " i]");
    }

    /**
     * Inputs and textareas whose {@code name} equals {@code value}.
     */
    public static By nameEquals(String value) {
        String v = cssString(value);
        return By.cssSelector("input[name=" + v + "], textarea[name=" + v + "]");
    }

    public static By css(String selector) {
        return By.cssSelector(selector);
    }

    public static List<By> css(List<String> selectors) {
        return selectors.stream().map(By::cssSelector).toList();
    }

    /**
     * XPath string literal, using {@code concat()} when the value holds both quote kinds.
     */
    static String literal(String s) {
        if (!s.contains("'")) {
            return "'" + s + "'";
        }
        if (!s.contains("\"")) {
            return "\"" + s + "\"";
        }
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = s.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }

    static String cssString(String s) {
        String escaped = (s == null ? "" : s).replace("\\", "\\\\").replace("\"", "\\\"");
        return "\"" + escaped + "\"";
    }

    private static String nameContains(String name) {
        String lit = literal(lowerCase(name));
        return "contains(" + lower("normalize-space(.)") + ", " + lit + ") or contains(" + lower("@aria-label") + ", " + lit + ")";
    }

    private static String lower(String expr) {
        return "translate(" + expr + ", '" + UPPER + "', '" + LOWER + "')";
    }

    private static String lowerCase(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    private static String prefix(boolean relative) {
        return relative ? ".//" : "//";
    }
}
