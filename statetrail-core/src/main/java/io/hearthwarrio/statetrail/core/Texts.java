package io.hearthwarrio.statetrail.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;

/**
 * Null-tolerant text helpers shared by matchers and detectors.
 */
public final class Texts {

    private Texts() {
        // utility class
    }

    /**
     * @return trimmed lower-case value, or empty string for null
     */
    public static String lower(String v) {
        if (v == null) {
            return "";
        }
        return v.trim().toLowerCase(Locale.ROOT);
    }

    public static String safe(String v) {
        return v == null ? "" : v;
    }

    /**
     * Case-insensitive substring test against any of the needles. Empty needles never match.
     */
    public static boolean containsAny(String haystack, Collection<String> needles) {
        if (haystack == null || needles == null) {
            return false;
        }
        String h = lower(haystack);
        for (String n : needles) {
            if (n == null || n.isEmpty()) {
                continue;
            }
            if (h.contains(lower(n))) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsAny(String haystack, String... needles) {
        return containsAny(haystack, Arrays.asList(needles));
    }

    /**
     * Collapses whitespace runs to single spaces and trims.
     */
    public static String normalizeSpace(String s) {
        if (s == null) {
            return "";
        }
        return s.replaceAll("\\s+", " ").trim();
    }
}
