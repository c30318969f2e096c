package io.hearthwarrio.statetrail.core;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one executed action.
 * <p>
 * Serialized flat, with the type-specific details next to {@code success}, {@code action},
 * {@code method} and {@code error}, e.g. {@code {"success":true,"action":"click_submit","method":"modal-keyword","button":"Create"}}.
 */
@JsonPropertyOrder({"success", "action", "method", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ActionResult {

    public static final String URL = "url";
    public static final String TEXT = "text";
    public static final String BUTTON = "button";
    public static final String SELECTOR = "selector";
    public static final String TITLE = "title";
    public static final String FILLED = "filled";
    public static final String ERRORS = "errors";
    public static final String IS_SEARCH = "is_search";
    public static final String AUTH_STATE = "auth_state";

    private final boolean success;
    private final String action;
    private final String method;
    private final String error;
    private final Map<String, Object> details;

    private ActionResult(boolean success, String action, String method, String error, Map<String, Object> details) {
        this.success = success;
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.method = method;
        this.error = error;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Builder success(String action) {
        return new Builder(true, action);
    }

    public static Builder failure(String action, String error) {
        return new Builder(false, action).error(error);
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("action")
    public String getAction() {
        return action;
    }

    /**
     * @return resolution tier that succeeded, or null when the action has no tiers or failed
     */
    @JsonProperty("method")
    public String getMethod() {
        return method;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        return details;
    }

    public Object getDetail(String key) {
        return details.get(key);
    }

    public String getDetailText(String key) {
        Object v = details.get(key);
        return v == null ? null : String.valueOf(v);
    }

    @Override
    public String toString() {
        return "ActionResult{" +
                "success=" + success +
                ", action='" + action + '\'' +
                (method == null ? "" : ", method='" + method + '\'') +
                (error == null ? "" : ", error='" + error + '\'') +
                (details.isEmpty() ? "" : ", details=" + details) +
                '}';
    }

    public static final class Builder {
        private final boolean success;
        private final String action;
        private String method;
        private String error;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(boolean success, String action) {
            this.success = success;
            this.action = action;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, value);
            }
            return this;
        }

        public ActionResult build() {
            return new ActionResult(success, action, method, error, details);
        }
    }
}
