package io.hearthwarrio.statetrail.core.action;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Submits the current form or dialog.
 * <p>
 * An empty candidate list means "use the configured common button texts".
 */
public final class ClickSubmitAction implements Action {

    private final List<String> candidateTexts;

    public ClickSubmitAction() {
        this(List.of());
    }

    public ClickSubmitAction(List<String> candidateTexts) {
        Objects.requireNonNull(candidateTexts, "candidateTexts must not be null");
        List<String> cleaned = new ArrayList<>();
        for (String t : candidateTexts) {
            if (t != null && !t.isBlank()) {
                cleaned.add(t);
            }
        }
        this.candidateTexts = List.copyOf(cleaned);
    }

    public List<String> getCandidateTexts() {
        return candidateTexts;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.CLICK_SUBMIT;
    }

    @Override
    public String describe() {
        return "click_submit -> clicking submit button";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClickSubmitAction)) return false;
        return candidateTexts.equals(((ClickSubmitAction) o).candidateTexts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), candidateTexts);
    }

    @Override
    public String toString() {
        return "ClickSubmitAction{candidateTexts=" + candidateTexts + "}";
    }
}
