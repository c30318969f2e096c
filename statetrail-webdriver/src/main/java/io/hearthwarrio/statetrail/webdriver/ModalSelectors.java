package io.hearthwarrio.statetrail.webdriver;

import java.util.List;

/**
 * CSS selectors that identify modal-like containers, most specific first.
 */
public final class ModalSelectors {

    public static final List<String> CONTAINERS = List.of(
            "[role=\"dialog\"]",
            ".modal",
            "[class*=\"modal\" i]",
            "[class*=\"dialog\" i]",
            "[class*=\"overlay\" i]"
    );

    /**
     * Buttons inside a modal-like container.
     */
    public static final String BUTTONS =
            "[role=\"dialog\"] button, .modal button, [class*=\"modal\" i] button, [class*=\"dialog\" i] button";

    private ModalSelectors() {
        // utility class
    }
}
