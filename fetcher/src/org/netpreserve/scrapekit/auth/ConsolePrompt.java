package org.netpreserve.scrapekit.auth;

import java.io.Console;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Prompts on the terminal, with the password read without echo.
 */
public class ConsolePrompt implements CredentialPrompt {
    @Override
    public boolean available() {
        return System.console() != null;
    }

    @Override
    public Credentials ask(String key) throws IOException {
        Console console = System.console();
        if (console == null) throw new IOException("No console to prompt for credentials");
        console.printf("%nPlease enter credentials for %s:%n", key);
        String username = console.readLine("Username: ");
        char[] password = console.readPassword("Password: ");
        if (username == null || password == null) throw new IOException("Credential prompt cancelled");
        String save = console.readLine("Save credentials for future use? (y/n): ");
        try {
            return new Credentials(username, new String(password),
                    save != null && save.trim().toLowerCase(Locale.ROOT).startsWith("y"));
        } finally {
            Arrays.fill(password, ' ');
        }
    }
}
