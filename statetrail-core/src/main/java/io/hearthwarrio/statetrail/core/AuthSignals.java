package io.hearthwarrio.statetrail.core;

/**
 * Raw observations gathered from the live page for auth classification.
 */
public final class AuthSignals {

    private final String url;
    private final boolean hasEmailField;
    private final boolean hasPasswordField;
    private final String loginButtonText;

    /**
     * @param url              current page URL
     * @param hasEmailField    whether an email-like input exists
     * @param hasPasswordField whether a password input exists
     * @param loginButtonText  description of a visible login affordance, or null when none was found
     */
    public AuthSignals(String url, boolean hasEmailField, boolean hasPasswordField, String loginButtonText) {
        this.url = Texts.safe(url);
        this.hasEmailField = hasEmailField;
        this.hasPasswordField = hasPasswordField;
        this.loginButtonText = loginButtonText == null || loginButtonText.isBlank() ? null : loginButtonText;
    }

    public String getUrl() {
        return url;
    }

    public boolean hasEmailField() {
        return hasEmailField;
    }

    public boolean hasPasswordField() {
        return hasPasswordField;
    }

    public String getLoginButtonText() {
        return loginButtonText;
    }

    @Override
    public String toString() {
        return "AuthSignals{" +
                "url='" + url + '\'' +
                ", email=" + hasEmailField +
                ", password=" + hasPasswordField +
                ", loginButton=" + loginButtonText +
                '}';
    }
}
