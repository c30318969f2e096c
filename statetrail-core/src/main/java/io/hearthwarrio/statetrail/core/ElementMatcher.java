package io.hearthwarrio.statetrail.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context-aware matcher over a {@link PageSummary}.
 * <p>
 * Stateless: the same summary and task always produce the same answer.
 * <p>
 * Button scoring (weights from {@link MatcherWeights}):
 * <ul>
 *   <li>action keyword from the task present in the button text</li>
 *   <li>object noun from the task present in the button text</li>
 *   <li>combo bonus when both are present</li>
 *   <li>in-modal bonus while a modal is open</li>
 *   <li>"create" preference and "add" penalty when the task says create</li>
 * </ul>
 * Candidates scoring zero or less are discarded. Ties go to the earlier button in scan order.
 */
public class ElementMatcher {

    private static final Map<String, List<String>> ACTION_CLUSTERS = new LinkedHashMap<>();

    static {
        ACTION_CLUSTERS.put("create", List.of("create", "new", "add"));
        ACTION_CLUSTERS.put("save", List.of("save", "update", "edit"));
        ACTION_CLUSTERS.put("submit", List.of("submit", "confirm", "send"));
        ACTION_CLUSTERS.put("delete", List.of("delete", "remove"));
        ACTION_CLUSTERS.put("cancel", List.of("cancel", "close"));
    }

    private static final List<String> OBJECT_NOUNS = List.of(
            "project", "issue", "task", "page", "item", "note", "card", "document"
    );

    private static final List<String> NAVIGATION_CATEGORIES = List.of(
            "project", "issue", "task", "page", "document", "database", "team", "settings"
    );

    private final MatcherWeights weights;

    public ElementMatcher() {
        this(MatcherWeights.defaults());
    }

    public ElementMatcher(MatcherWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights must not be null");
    }

    public MatcherWeights getWeights() {
        return weights;
    }

    public Optional<ButtonMatch> matchButton(PageSummary summary, TaskContext task) {
        List<ButtonMatch> ranked = rankButtons(summary, task);
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    /**
     * Scores every summarized button and returns the positive ones, best first.
     *
     * @param summary page summary
     * @param task    task context
     * @return ranked matches; empty when nothing scores above zero
     */
    public List<ButtonMatch> rankButtons(PageSummary summary, TaskContext task) {
        if (summary == null || task == null || !task.isPresent() || summary.getButtons().isEmpty()) {
            return List.of();
        }

        List<String> actionKeywords = actionKeywords(task);
        List<String> objectKeywords = objectKeywords(task);
        boolean taskSaysCreate = task.mentions("create");

        List<ButtonMatch> scored = new ArrayList<>();
        for (ButtonInfo button : summary.getButtons()) {
            int score = scoreButton(button, summary.hasModal(), actionKeywords, objectKeywords, taskSaysCreate);
            if (score > 0) {
                scored.add(new ButtonMatch(button, score));
            }
        }

        // List.sort is stable: equal scores keep scan order
        scored.sort(Comparator.comparingInt(ButtonMatch::getScore).reversed());
        return scored;
    }

    int scoreButton(
            ButtonInfo button,
            boolean modalOpen,
            List<String> actionKeywords,
            List<String> objectKeywords,
            boolean taskSaysCreate
    ) {
        String text = Texts.lower(button.getText().isEmpty() ? button.getAriaLabel() : button.getText());
        int score = 0;

        boolean hasAction = Texts.containsAny(text, actionKeywords);
        boolean hasObject = Texts.containsAny(text, objectKeywords);

        if (hasAction) {
            score += weights.getActionKeyword();
        }
        if (hasObject) {
            score += weights.getObjectKeyword();
        }
        if (hasAction && hasObject) {
            score += weights.getActionObjectCombo();
        }
        if (modalOpen && button.isInModal()) {
            score += weights.getInModal();
        }
        if (taskSaysCreate) {
            boolean saysCreate = text.contains("create");
            boolean saysAdd = text.contains("add");
            if (saysCreate && !saysAdd) {
                score += weights.getCreatePreference();
            }
            if (saysAdd && !saysCreate) {
                score -= weights.getAddPenalty();
            }
        }
        return score;
    }

    /**
     * Returns the first navigation link whose text contains a category noun mentioned by the task.
     */
    public Optional<NavigationLink> matchNavigation(PageSummary summary, TaskContext task) {
        if (summary == null || task == null || !task.isPresent()) {
            return Optional.empty();
        }
        List<String> categories = new ArrayList<>();
        for (String c : NAVIGATION_CATEGORIES) {
            if (task.mentions(c)) {
                categories.add(c);
            }
        }
        if (categories.isEmpty()) {
            return Optional.empty();
        }
        for (NavigationLink link : summary.getNavigation()) {
            if (Texts.containsAny(link.getText(), categories)) {
                return Optional.of(link);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the input best matching a requested field name: exact name/placeholder/label first,
     * then substring, then the first plain text-like input.
     */
    public Optional<InputField> matchInput(PageSummary summary, String fieldName) {
        if (summary == null || summary.getInputs().isEmpty()) {
            return Optional.empty();
        }
        String field = Texts.lower(fieldName);
        if (!field.isEmpty()) {
            for (InputField input : summary.getInputs()) {
                if (field.equals(Texts.lower(input.getName()))
                        || field.equals(Texts.lower(input.getPlaceholder()))
                        || field.equals(Texts.lower(input.getLabel()))) {
                    return Optional.of(input);
                }
            }
            for (InputField input : summary.getInputs()) {
                if (Texts.lower(input.getName()).contains(field)
                        || Texts.lower(input.getPlaceholder()).contains(field)
                        || Texts.lower(input.getLabel()).contains(field)) {
                    return Optional.of(input);
                }
            }
        }
        for (InputField input : summary.getInputs()) {
            if (input.isTextLike()) {
                return Optional.of(input);
            }
        }
        return Optional.empty();
    }

    static List<String> actionKeywords(TaskContext task) {
        List<String> out = new ArrayList<>();
        String t = task.lower();
        for (List<String> cluster : ACTION_CLUSTERS.values()) {
            if (Texts.containsAny(t, cluster)) {
                out.addAll(cluster);
            }
        }
        return out;
    }

    static List<String> objectKeywords(TaskContext task) {
        List<String> out = new ArrayList<>();
        for (String noun : OBJECT_NOUNS) {
            if (task.mentions(noun)) {
                out.add(noun);
            }
        }
        return out;
    }
}
