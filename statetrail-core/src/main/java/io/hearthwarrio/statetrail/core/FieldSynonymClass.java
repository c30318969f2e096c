package io.hearthwarrio.statetrail.core;

import java.util.List;

/**
 * Recognized families of requested field names. Each family has its own selector cascade when filling.
 */
public enum FieldSynonymClass {
    SEARCH(List.of("q", "search", "query")),
    CODE_EDITOR(List.of("code", "editor", "solution")),
    GENERIC(List.of());

    private final List<String> names;

    FieldSynonymClass(List<String> names) {
        this.names = names;
    }

    public List<String> getNames() {
        return names;
    }

    public static FieldSynonymClass of(String fieldName) {
        String f = Texts.lower(fieldName);
        for (FieldSynonymClass c : values()) {
            if (c.names.contains(f)) {
                return c;
            }
        }
        return GENERIC;
    }
}
