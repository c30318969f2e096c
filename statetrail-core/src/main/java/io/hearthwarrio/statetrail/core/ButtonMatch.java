package io.hearthwarrio.statetrail.core;

/**
 * Result of ranking summarized buttons against a task.
 */
public final class ButtonMatch {

    private final ButtonInfo button;
    private final int score;

    public ButtonMatch(ButtonInfo button, int score) {
        this.button = button;
        this.score = score;
    }

    public ButtonInfo getButton() {
        return button;
    }

    public int getScore() {
        return score;
    }

    @Override
    public String toString() {
        return "ButtonMatch{" +
                "score=" + score +
                ", button=" + button +
                '}';
    }
}
