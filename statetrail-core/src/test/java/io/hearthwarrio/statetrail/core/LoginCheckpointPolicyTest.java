package io.hearthwarrio.statetrail.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoginCheckpointPolicyTest {

    private static AuthState state(boolean requiresLogin, String button, String url) {
        return new AuthState(false, requiresLogin, button, false, false, url);
    }

    @Test
    void defaultsSuspendOnRequiredLoginOrAnyLoginButton() {
        LoginCheckpointPolicy policy = LoginCheckpointPolicy.defaults();

        assertTrue(policy.shouldSuspend(state(true, null, "https://example.com/app")));
        assertTrue(policy.shouldSuspend(state(false, "Sign in", "https://example.com/app/deep/path")));
        assertFalse(policy.shouldSuspend(state(false, null, "https://example.com/")));
    }

    @Test
    void rootOnlyPolicyIgnoresLoginButtonsOnDeepPages() {
        LoginCheckpointPolicy policy = LoginCheckpointPolicy.defaults()
                .withOnRequiresLogin(false)
                .withOnLoginButton(false);

        assertTrue(policy.shouldSuspend(state(false, "Log in", "https://example.com/")));
        assertFalse(policy.shouldSuspend(state(false, "Log in", "https://example.com/team/projects")));
        assertFalse(policy.shouldSuspend(state(true, null, "https://example.com/")));
    }

    @Test
    void disabledPolicyNeverSuspends() {
        LoginCheckpointPolicy policy = LoginCheckpointPolicy.disabled();

        assertFalse(policy.shouldSuspend(state(true, "Sign in", "https://example.com/login")));
        assertFalse(policy.shouldSuspend(null));
    }

    @Test
    void rootPageHasAtMostThreeSlashes() {
        assertTrue(LoginCheckpointPolicy.isRootPage("https://example.com"));
        assertTrue(LoginCheckpointPolicy.isRootPage("https://example.com/"));
        assertFalse(LoginCheckpointPolicy.isRootPage("https://example.com/a/"));
    }
}
