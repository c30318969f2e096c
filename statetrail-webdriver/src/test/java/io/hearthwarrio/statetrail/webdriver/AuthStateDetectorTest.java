package io.hearthwarrio.statetrail.webdriver;

import io.hearthwarrio.statetrail.core.AuthState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebElement;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class AuthStateDetectorTest {
    private final ScriptableDriver driver = mock(ScriptableDriver.class);
    private final WebElement visible = mock(WebElement.class);
    private AuthStateDetector detector;

    @BeforeEach
    void setUp() {
        PageProbe probe = new PageProbe(driver, Clock.systemUTC(), duration -> { });
        detector = new AuthStateDetector(probe, Duration.ZERO);
        when(visible.isDisplayed()).thenReturn(true);
    }

    @Test
    void loginFormOnLoginPathIsLoginPage() {
        when(driver.getCurrentUrl()).thenReturn("https://app.example.com/login?next=%2Fprojects");
        when(driver.findElements(eq(AuthStateDetector.EMAIL_FIELDS))).thenReturn(List.of(visible));
        when(driver.findElements(eq(AuthStateDetector.PASSWORD_FIELDS))).thenReturn(List.of(visible));

        AuthState state = detector.detect();

        assertTrue(state.isLoginPage());
        assertTrue(state.requiresLogin());
        assertTrue(state.hasEmailField());
        assertTrue(state.hasPasswordField());
    }

    @Test
    void visibleSignInButtonWithoutFormRequiresLogin() {
        when(driver.getCurrentUrl()).thenReturn("https://www.example.com/");
        when(driver.findElements(eq(Locators.roleButton("sign in", false)))).thenReturn(List.of(visible));

        AuthState state = detector.detect();

        assertFalse(state.isLoginPage());
        assertTrue(state.requiresLogin());
        assertEquals("sign in", state.getLoginButtonText());
    }

    @Test
    void ariaLabelledButtonIsReportedGenerically() {
        when(driver.getCurrentUrl()).thenReturn("https://www.example.com/pricing");
        when(driver.findElements(eq(By.cssSelector(AuthStateDetector.LOGIN_ARIA_SELECTORS.get(1)))))
                .thenReturn(List.of(visible));

        assertEquals(AuthStateDetector.ARIA_LABEL_BUTTON, detector.detect().getLoginButtonText());
    }

    @Test
    void hiddenButtonsAreIgnored() {
        WebElement hidden = mock(WebElement.class);
        when(driver.getCurrentUrl()).thenReturn("https://app.example.com/projects");
        when(driver.findElements(eq(Locators.roleButton("log in", false)))).thenReturn(List.of(hidden));

        AuthState state = detector.detect();

        assertFalse(state.hasLoginButton());
        assertFalse(state.requiresLogin());
    }

    @Test
    void lostSessionPropagates() {
        when(driver.getCurrentUrl()).thenThrow(new NoSuchSessionException("closed"));

        assertThrows(NoSuchSessionException.class, () -> detector.detect());
    }
}
