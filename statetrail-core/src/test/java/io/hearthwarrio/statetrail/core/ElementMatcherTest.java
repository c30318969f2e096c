package io.hearthwarrio.statetrail.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ElementMatcherTest {
    private final ElementMatcher matcher = new ElementMatcher();

    private static PageSummary buttons(boolean hasModal, ButtonInfo... buttons) {
        return new PageSummary(List.of(buttons), List.of(), List.of(), hasModal, "https://app.example.com/projects");
    }

    @Test
    void prefersCreateButtonInsideOpenModal() {
        ButtonInfo headerNew = new ButtonInfo("New", "", false);
        ButtonInfo add = new ButtonInfo("Add", "", true);
        ButtonInfo cancel = new ButtonInfo("Cancel", "", true);
        ButtonInfo createProject = new ButtonInfo("Create Project", "", true);

        PageSummary summary = buttons(true, headerNew, add, cancel, createProject);
        Optional<ButtonMatch> match = matcher.matchButton(summary, TaskContext.of("Create a project called Alpha"));

        assertTrue(match.isPresent());
        assertEquals("Create Project", match.get().getButton().getText());
    }

    @Test
    void modalBonusOnlyAppliesWhileModalIsOpen() {
        ButtonInfo page = new ButtonInfo("Save issue", "", false);
        ButtonInfo staleModal = new ButtonInfo("Save", "", true);

        Optional<ButtonMatch> match = matcher.matchButton(buttons(false, staleModal, page), TaskContext.of("save the issue"));

        assertTrue(match.isPresent());
        assertEquals("Save issue", match.get().getButton().getText());
    }

    @Test
    void tiesGoToEarlierButtonInScanOrder() {
        ButtonInfo first = new ButtonInfo("Create", "first", false);
        ButtonInfo second = new ButtonInfo("Create", "second", false);

        List<ButtonMatch> ranked = matcher.rankButtons(buttons(false, first, second), TaskContext.of("create something"));

        assertEquals(2, ranked.size());
        assertEquals(ranked.get(0).getScore(), ranked.get(1).getScore());
        assertSame(first, ranked.get(0).getButton());
    }

    @Test
    void addIsPenalisedWhenTaskSaysCreate() {
        ButtonInfo add = new ButtonInfo("Add", "", false);
        ButtonInfo create = new ButtonInfo("Create", "", false);

        List<ButtonMatch> ranked = matcher.rankButtons(buttons(false, add, create), TaskContext.of("create a page"));

        assertEquals("Create", ranked.get(0).getButton().getText());
        assertEquals(20, ranked.get(0).getScore());
        assertEquals(5, ranked.get(1).getScore());
    }

    @Test
    void returnsEmptyWithoutTaskOrWhenNothingScores() {
        PageSummary summary = buttons(false, new ButtonInfo("Help", "", false));

        assertTrue(matcher.matchButton(summary, TaskContext.none()).isEmpty());
        assertTrue(matcher.matchButton(summary, TaskContext.of("create a project")).isEmpty());
    }

    @Test
    void usesAriaLabelWhenButtonHasNoText() {
        ButtonInfo icon = new ButtonInfo("", "Create issue", false);

        Optional<ButtonMatch> match = matcher.matchButton(buttons(false, icon), TaskContext.of("create an issue"));

        assertTrue(match.isPresent());
        assertEquals(40, match.get().getScore());
    }

    @Test
    void customWeightsChangeTheWinner() {
        MatcherWeights weights = MatcherWeights.defaults().withInModal(0).withCreatePreference(0);
        ElementMatcher custom = new ElementMatcher(weights);

        ButtonInfo pageButton = new ButtonInfo("New project", "", false);
        ButtonInfo modalButton = new ButtonInfo("Create", "", true);

        Optional<ButtonMatch> match = custom.matchButton(buttons(true, modalButton, pageButton), TaskContext.of("create project"));

        assertEquals("New project", match.get().getButton().getText());
    }

    @Test
    void navigationMatchesFirstLinkForMentionedCategory() {
        PageSummary summary = new PageSummary(
                List.of(),
                List.of(new NavigationLink("Home"), new NavigationLink("My Issues"), new NavigationLink("Projects")),
                List.of(),
                false,
                "https://app.example.com"
        );

        Optional<NavigationLink> link = matcher.matchNavigation(summary, TaskContext.of("open the projects list"));

        assertTrue(link.isPresent());
        assertEquals("Projects", link.get().getText());
        assertTrue(matcher.matchNavigation(summary, TaskContext.of("log out")).isEmpty());
    }

    @Test
    void inputPrefersExactThenSubstringThenFirstTextLike() {
        InputField checkbox = new InputField("checkbox", "remember", "", "");
        InputField title = new InputField("text", "issue_title", "", "Title");
        InputField description = new InputField("text", "description", "Describe it", "");
        PageSummary summary = new PageSummary(List.of(), List.of(), List.of(checkbox, title, description), false, "");

        assertEquals(title, matcher.matchInput(summary, "title").get());
        assertEquals(description, matcher.matchInput(summary, "describe").get());
        assertEquals(title, matcher.matchInput(summary, "priority").get());
    }

    @Test
    void sameSummaryGivesSameAnswer() {
        PageSummary summary = buttons(true, new ButtonInfo("Add", "", true), new ButtonInfo("Create Project", "", true));
        TaskContext task = TaskContext.of("create a project");

        assertEquals(matcher.rankButtons(summary, task).size(), matcher.rankButtons(summary, task).size());
        assertEquals(
                matcher.matchButton(summary, task).get().getButton(),
                matcher.matchButton(summary, task).get().getButton()
        );
    }
}
