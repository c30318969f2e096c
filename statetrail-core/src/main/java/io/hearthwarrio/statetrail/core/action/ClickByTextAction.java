package io.hearthwarrio.statetrail.core.action;

import java.util.Objects;

public final class ClickByTextAction implements Action {

    private final String text;

    public ClickByTextAction(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    public String getText() {
        return text;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.CLICK_BY_TEXT;
    }

    @Override
    public String describe() {
        return "click_by_text -> '" + text + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClickByTextAction)) return false;
        return text.equals(((ClickByTextAction) o).text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), text);
    }

    @Override
    public String toString() {
        return "ClickByTextAction{text='" + text + "'}";
    }
}
