package io.hearthwarrio.statetrail.core;

import java.util.List;

/**
 * Classifies {@link AuthSignals} into an {@link AuthState}.
 * <p>
 * Rules:
 * <ul>
 *   <li>URL indicators (login, signin, auth, oauth) mark a login page on their own</li>
 *   <li>an email field together with a password field is a login form; a form only marks a login page
 *   when the URL also carries {@code /login} or {@code /signin}</li>
 *   <li>login is required on a login page, or when a login button is visible but no form is present
 *   (marketing homepages that gate features behind a sign-in click)</li>
 * </ul>
 */
public final class AuthStateClassifier {

    private static final List<String> LOGIN_URL_INDICATORS = List.of("login", "signin", "auth", "oauth");

    private static final List<String> LOGIN_PATH_FRAGMENTS = List.of("/login", "/signin");

    public AuthState classify(AuthSignals signals) {
        String url = Texts.lower(signals.getUrl());

        boolean loginUrl = Texts.containsAny(url, LOGIN_URL_INDICATORS);
        boolean loginForm = signals.hasEmailField() && signals.hasPasswordField();
        boolean loginPage = loginUrl || (loginForm && Texts.containsAny(url, LOGIN_PATH_FRAGMENTS));
        boolean loginButton = signals.getLoginButtonText() != null;
        boolean requiresLogin = loginPage || (loginButton && !loginForm);

        return new AuthState(
                loginPage,
                requiresLogin,
                signals.getLoginButtonText(),
                signals.hasEmailField(),
                signals.hasPasswordField(),
                signals.getUrl()
        );
    }

    /**
     * Whether the URL path itself names a dedicated login route (/login, /signin, /auth).
     * Used to fail clicks fast instead of searching a login screen.
     */
    public static boolean isDedicatedLoginPath(String url) {
        return Texts.containsAny(Texts.lower(url), "/login", "/signin", "/auth");
    }
}
