package io.hearthwarrio.statetrail.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decides whether an {@link AuthState} observed after navigation should suspend the run for manual login.
 * <p>
 * The signals overlap and their precedence is a judgment call: URL-based login pages, a visible sign-in
 * affordance anywhere, or a sign-in affordance on a site root. Each trigger can be switched off on its own.
 * Defaults suspend on all three.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LoginCheckpointPolicy {

    @JsonProperty("enabled")
    private boolean enabled = true;

    @JsonProperty("on_requires_login")
    private boolean onRequiresLogin = true;

    @JsonProperty("on_login_button")
    private boolean onLoginButton = true;

    @JsonProperty("on_root_login_button")
    private boolean onRootLoginButton = true;

    public LoginCheckpointPolicy() {
    }

    public static LoginCheckpointPolicy defaults() {
        return new LoginCheckpointPolicy();
    }

    public static LoginCheckpointPolicy disabled() {
        return new LoginCheckpointPolicy().withEnabled(false);
    }

    public boolean shouldSuspend(AuthState state) {
        if (!enabled || state == null) {
            return false;
        }
        if (onRequiresLogin && state.requiresLogin()) {
            return true;
        }
        if (onLoginButton && state.hasLoginButton()) {
            return true;
        }
        return onRootLoginButton && state.hasLoginButton() && isRootPage(state.getUrl());
    }

    /**
     * Root-like URL: {@code https://example.com} or {@code https://example.com/}.
     */
    public static boolean isRootPage(String url) {
        String u = Texts.safe(url);
        int slashes = 0;
        for (int i = 0; i < u.length(); i++) {
            if (u.charAt(i) == '/') {
                slashes++;
            }
        }
        return slashes <= 3;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isOnRequiresLogin() {
        return onRequiresLogin;
    }

    public boolean isOnLoginButton() {
        return onLoginButton;
    }

    public boolean isOnRootLoginButton() {
        return onRootLoginButton;
    }

    public LoginCheckpointPolicy withEnabled(boolean v) {
        this.enabled = v;
        return this;
    }

    public LoginCheckpointPolicy withOnRequiresLogin(boolean v) {
        this.onRequiresLogin = v;
        return this;
    }

    public LoginCheckpointPolicy withOnLoginButton(boolean v) {
        this.onLoginButton = v;
        return this;
    }

    public LoginCheckpointPolicy withOnRootLoginButton(boolean v) {
        this.onRootLoginButton = v;
        return this;
    }

    @Override
    public String toString() {
        return "LoginCheckpointPolicy{" +
                "enabled=" + enabled +
                ", onRequiresLogin=" + onRequiresLogin +
                ", onLoginButton=" + onLoginButton +
                ", onRootLoginButton=" + onRootLoginButton +
                '}';
    }
}
