package io.hearthwarrio.statetrail.core.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fills several fields; every entry is resolved independently, in insertion order.
 */
public final class FillInputsAction implements Action {

    private static final int PREVIEW_LIMIT = 50;

    private final Map<String, String> inputs;

    public FillInputsAction(Map<String, String> inputs) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : inputs.entrySet()) {
            if (e.getKey() == null) {
                continue;
            }
            copy.put(e.getKey(), e.getValue() == null ? "" : e.getValue());
        }
        this.inputs = Collections.unmodifiableMap(copy);
    }

    /**
     * @return field name to value, in plan order
     */
    public Map<String, String> getInputs() {
        return inputs;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.FILL_INPUTS;
    }

    @Override
    public String describe() {
        if (inputs.isEmpty()) {
            return "fill_inputs";
        }
        Map.Entry<String, String> first = inputs.entrySet().iterator().next();
        String value = first.getValue();
        if (value.length() > PREVIEW_LIMIT) {
            value = value.substring(0, PREVIEW_LIMIT) + "...";
        }
        return "fill_inputs -> " + first.getKey() + ": " + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FillInputsAction)) return false;
        return inputs.equals(((FillInputsAction) o).inputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), inputs);
    }

    @Override
    public String toString() {
        return "FillInputsAction{inputs=" + inputs.keySet() + "}";
    }
}
