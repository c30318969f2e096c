package io.hearthwarrio.statetrail.core;

import java.util.Objects;

/**
 * Visible button as seen by the page summary: its text (or accessible label when it has no text)
 * and whether it sits inside the currently open modal.
 */
public final class ButtonInfo {

    private final String text;
    private final String ariaLabel;
    private final boolean inModal;

    public ButtonInfo(String text, String ariaLabel, boolean inModal) {
        this.text = Texts.safe(text).trim();
        this.ariaLabel = Texts.safe(ariaLabel).trim();
        this.inModal = inModal;
    }

    public String getText() {
        return text;
    }

    public String getAriaLabel() {
        return ariaLabel;
    }

    public boolean isInModal() {
        return inModal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ButtonInfo)) return false;
        ButtonInfo that = (ButtonInfo) o;
        return inModal == that.inModal && text.equals(that.text) && ariaLabel.equals(that.ariaLabel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, ariaLabel, inModal);
    }

    @Override
    public String toString() {
        return "ButtonInfo{text='" + text + "', ariaLabel='" + ariaLabel + "', inModal=" + inModal + '}';
    }
}
