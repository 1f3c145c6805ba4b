package io.surfworks.fcc.license;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Prompts for license credentials on a text console.
 *
 * <p>Keys are trimmed and upper-cased. An empty key or end of input cancels.
 */
public class ConsolePromptProvider implements PromptProvider {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePromptProvider() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public ConsolePromptProvider(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Optional<Credentials> prompt(String defaultEmail) {
        out.println();
        out.println("=== Financial Command Center License Verification ===");
        try {
            out.print("License key: ");
            out.flush();
            String key = in.readLine();
            if (key == null || key.isBlank()) {
                return Optional.empty();
            }

            String shownDefault = defaultEmail == null || defaultEmail.isBlank() ? "optional" : defaultEmail;
            out.print("Registered email [" + shownDefault + "]: ");
            out.flush();
            String email = in.readLine();
            if (email == null || email.isBlank()) {
                email = defaultEmail == null ? "" : defaultEmail;
            }
            return Optional.of(new Credentials(key.strip().toUpperCase(Locale.ROOT), email.strip()));
        } catch (IOException e) {
            out.println();
            return Optional.empty();
        }
    }

    @Override
    public void showError(String message) {
        out.println("ERROR: " + message);
    }
}
