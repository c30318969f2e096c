package io.hearthwarrio.statetrail.core;

import java.util.List;
import java.util.Objects;

/**
 * Structural snapshot of the live page at the moment of query.
 * <p>
 * Sequences keep page scan order. A summary is never reused across actions since the page may have changed.
 */
public final class PageSummary {

    private final List<ButtonInfo> buttons;
    private final List<NavigationLink> navigation;
    private final List<InputField> inputs;
    private final boolean hasModal;
    private final String url;

    public PageSummary(
            List<ButtonInfo> buttons,
            List<NavigationLink> navigation,
            List<InputField> inputs,
            boolean hasModal,
            String url
    ) {
        this.buttons = List.copyOf(Objects.requireNonNull(buttons, "buttons must not be null"));
        this.navigation = List.copyOf(Objects.requireNonNull(navigation, "navigation must not be null"));
        this.inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs must not be null"));
        this.hasModal = hasModal;
        this.url = Texts.safe(url);
    }

    public static PageSummary empty(String url) {
        return new PageSummary(List.of(), List.of(), List.of(), false, url);
    }

    public List<ButtonInfo> getButtons() {
        return buttons;
    }

    public List<NavigationLink> getNavigation() {
        return navigation;
    }

    public List<InputField> getInputs() {
        return inputs;
    }

    public boolean hasModal() {
        return hasModal;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public String toString() {
        return "PageSummary{" +
                "buttons=" + buttons.size() +
                ", navigation=" + navigation.size() +
                ", inputs=" + inputs.size() +
                ", hasModal=" + hasModal +
                ", url='" + url + '\'' +
                '}';
    }
}
