package io.hearthwarrio.statetrail.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Integer bonuses used by {@link ElementMatcher} when ranking buttons.
 * <p>
 * These encode product judgment (how strongly an in-modal button beats a page-wide one, how much
 * "Create" is preferred over "Add") and are therefore read from configuration rather than hardcoded
 * in the scoring routine.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MatcherWeights {

    @JsonProperty("action")
    private int actionKeyword = 10;

    @JsonProperty("object")
    private int objectKeyword = 5;

    @JsonProperty("combo")
    private int actionObjectCombo = 15;

    @JsonProperty("modal")
    private int inModal = 25;

    @JsonProperty("create_preference")
    private int createPreference = 10;

    /**
     * Subtracted (so configured as a positive number).
     */
    @JsonProperty("add_penalty")
    private int addPenalty = 5;

    public MatcherWeights() {
    }

    public static MatcherWeights defaults() {
        return new MatcherWeights();
    }

    public int getActionKeyword() {
        return actionKeyword;
    }

    public int getObjectKeyword() {
        return objectKeyword;
    }

    public int getActionObjectCombo() {
        return actionObjectCombo;
    }

    public int getInModal() {
        return inModal;
    }

    public int getCreatePreference() {
        return createPreference;
    }

    public int getAddPenalty() {
        return addPenalty;
    }

    public MatcherWeights withActionKeyword(int v) {
        this.actionKeyword = v;
        return this;
    }

    public MatcherWeights withObjectKeyword(int v) {
        this.objectKeyword = v;
        return this;
    }

    public MatcherWeights withActionObjectCombo(int v) {
        this.actionObjectCombo = v;
        return this;
    }

    public MatcherWeights withInModal(int v) {
        this.inModal = v;
        return this;
    }

    public MatcherWeights withCreatePreference(int v) {
        this.createPreference = v;
        return this;
    }

    public MatcherWeights withAddPenalty(int v) {
        this.addPenalty = v;
        return this;
    }

    @Override
    public String toString() {
        return "MatcherWeights{" +
                "action=" + actionKeyword +
                ", object=" + objectKeyword +
                ", combo=" + actionObjectCombo +
                ", modal=" + inModal +
                ", createPreference=" + createPreference +
                ", addPenalty=" + addPenalty +
                '}';
    }
}
