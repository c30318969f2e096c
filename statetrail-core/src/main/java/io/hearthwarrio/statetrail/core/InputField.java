package io.hearthwarrio.statetrail.core;

import java.util.Objects;

/**
 * Visible form input as seen by the page summary.
 * <p>
 * {@code type} defaults to {@code text} when the element declares none.
 */
public final class InputField {

    private final String type;
    private final String name;
    private final String placeholder;
    private final String label;

    public InputField(String type, String name, String placeholder, String label) {
        String t = Texts.safe(type).trim();
        this.type = t.isEmpty() ? "text" : t;
        this.name = Texts.safe(name).trim();
        this.placeholder = Texts.safe(placeholder).trim();
        this.label = Texts.safe(label).trim();
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Plain text-like input usable as a last-resort fill target.
     */
    public boolean isTextLike() {
        String t = Texts.lower(type);
        return t.isEmpty() || "text".equals(t) || "search".equals(t);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InputField)) return false;
        InputField that = (InputField) o;
        return type.equals(that.type) && name.equals(that.name)
                && placeholder.equals(that.placeholder) && label.equals(that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, placeholder, label);
    }

    @Override
    public String toString() {
        return "InputField{type='" + type + "', name='" + name + "', placeholder='" + placeholder
                + "', label='" + label + "'}";
    }
}
