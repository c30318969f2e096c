package io.hearthwarrio.statetrail.core;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folder-safe identifiers derived from task descriptions.
 */
public final class Slugs {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    private Slugs() {
        // utility class
    }

    /**
     * "Create a project in Linear!" becomes "create-a-project-in-linear".
     */
    public static String slugify(String text) {
        String s = Texts.safe(text).toLowerCase(Locale.ROOT);
        s = NON_WORD.matcher(s).replaceAll("");
        s = SEPARATORS.matcher(s).replaceAll("-");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}
