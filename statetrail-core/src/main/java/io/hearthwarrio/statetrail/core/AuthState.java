package io.hearthwarrio.statetrail.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Authentication classification of the current page. Computed fresh on every check, never persisted.
 */
@JsonPropertyOrder({
        "is_login_page", "requires_login", "has_login_button", "login_button_text",
        "url", "has_email_field", "has_password_field"
})
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class AuthState {

    private final boolean loginPage;
    private final boolean requiresLogin;
    private final String loginButtonText;
    private final boolean hasEmailField;
    private final boolean hasPasswordField;
    private final String url;

    public AuthState(
            boolean loginPage,
            boolean requiresLogin,
            String loginButtonText,
            boolean hasEmailField,
            boolean hasPasswordField,
            String url
    ) {
        this.loginPage = loginPage;
        this.requiresLogin = requiresLogin;
        this.loginButtonText = loginButtonText;
        this.hasEmailField = hasEmailField;
        this.hasPasswordField = hasPasswordField;
        this.url = Texts.safe(url);
    }

    @JsonProperty("is_login_page")
    public boolean isLoginPage() {
        return loginPage;
    }

    @JsonProperty("requires_login")
    public boolean requiresLogin() {
        return requiresLogin;
    }

    @JsonProperty("has_login_button")
    public boolean hasLoginButton() {
        return loginButtonText != null;
    }

    /**
     * @return detected login affordance description, or null
     */
    @JsonProperty("login_button_text")
    public String getLoginButtonText() {
        return loginButtonText;
    }

    @JsonProperty("has_email_field")
    public boolean hasEmailField() {
        return hasEmailField;
    }

    @JsonProperty("has_password_field")
    public boolean hasPasswordField() {
        return hasPasswordField;
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthState)) return false;
        AuthState that = (AuthState) o;
        return loginPage == that.loginPage
                && requiresLogin == that.requiresLogin
                && hasEmailField == that.hasEmailField
                && hasPasswordField == that.hasPasswordField
                && Objects.equals(loginButtonText, that.loginButtonText)
                && url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loginPage, requiresLogin, loginButtonText, hasEmailField, hasPasswordField, url);
    }

    @Override
    public String toString() {
        return "AuthState{" +
                "loginPage=" + loginPage +
                ", requiresLogin=" + requiresLogin +
                ", loginButton=" + loginButtonText +
                ", email=" + hasEmailField +
                ", password=" + hasPasswordField +
                ", url='" + url + '\'' +
                '}';
    }
}
