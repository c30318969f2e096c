package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.PageSummary;

/**
 * Produces a fresh {@link PageSummary} of the live page on each call.
 */
@FunctionalInterface
public interface PageSummaryReader {

    PageSummary read();
}
