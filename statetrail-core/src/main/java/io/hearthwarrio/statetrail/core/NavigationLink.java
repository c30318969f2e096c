package io.hearthwarrio.statetrail.core;

import java.util.Objects;

public final class NavigationLink {

    private final String text;

    public NavigationLink(String text) {
        this.text = Texts.safe(text).trim();
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NavigationLink)) return false;
        return text.equals(((NavigationLink) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return "NavigationLink{'" + text + "'}";
    }
}
