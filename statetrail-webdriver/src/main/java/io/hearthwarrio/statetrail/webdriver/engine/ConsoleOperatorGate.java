package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.AuthState;
import io.hearthwarrio.statetrail.webdriver.RunCancelledException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Prompts on a console stream and waits for ENTER.
 */
public final class ConsoleOperatorGate implements OperatorGate {

    private static final String RULE = "=".repeat(60);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleOperatorGate(BufferedReader in, PrintStream out) {
        this.in = Objects.requireNonNull(in, "in must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    public static ConsoleOperatorGate system() {
        return new ConsoleOperatorGate(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out
        );
    }

    @Override
    public void awaitResume(AuthState state) {
        out.println(prompt(state));
        out.print("Log in now, then press ENTER to continue: ");
        out.flush();
        try {
            String line = in.readLine();
            if (line == null) {
                throw new RunCancelledException("Operator input closed before login was confirmed", null);
            }
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Interrupted while waiting for login", e);
        } catch (IOException e) {
            throw new RunCancelledException("Cannot read operator input", e);
        }
    }

    static String prompt(AuthState state) {
        StringBuilder sb = new StringBuilder(256);
        sb.append(RULE).append('\n')
                .append("LOGIN REQUIRED").append('\n')
                .append(RULE).append('\n')
                .append("  Detected at: ").append(state.getUrl()).append('\n');
        if (state.hasLoginButton()) {
            sb.append("  Found login button: '").append(state.getLoginButtonText()).append("'\n")
                    .append("  Click it and complete authentication in the browser window.\n");
        } else if (state.isLoginPage()) {
            sb.append("  Detected login page.\n")
                    .append("  Log in manually in the browser window.\n");
        } else {
            sb.append("  Login may be required to continue.\n")
                    .append("  Log in manually in the browser window.\n");
        }
        sb.append("  The browser waits until you press ENTER here.\n")
                .append(RULE);
        return sb.toString();
    }
}
