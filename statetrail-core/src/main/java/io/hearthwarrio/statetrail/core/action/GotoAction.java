package io.hearthwarrio.statetrail.core.action;

import java.util.Objects;

public final class GotoAction implements Action {

    private final String url;

    public GotoAction(String url) {
        this.url = Objects.requireNonNull(url, "url must not be null");
    }

    public String getUrl() {
        return url;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.GOTO;
    }

    @Override
    public String describe() {
        return "goto -> " + url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GotoAction)) return false;
        return url.equals(((GotoAction) o).url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), url);
    }

    @Override
    public String toString() {
        return "GotoAction{url='" + url + "'}";
    }
}
