package org.netpreserve.scrapekit.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Login sequence for sites that need a session.
 *
 * @param url             login page
 * @param credentialsKey  key the credentials are stored under
 * @param secureStorage   keep saved credentials in the platform secret store rather than the credentials file
 * @param credentialsFile credentials file, defaults to {@code ~/.scraper/credentials.json}
 * @param fields          CSS selectors for the {@code username}, {@code password}, {@code submit} fields and an
 *                        optional {@code action} URL
 * @param failurePhrases  page text that means the login was rejected
 * @param successPhrases  page text that means the login worked
 */
public record LoginConfig(
        String url,
        String credentialsKey,
        boolean secureStorage,
        Path credentialsFile,
        Map<String, String> fields,
        List<String> failurePhrases,
        List<String> successPhrases
) {
    public LoginConfig {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
        failurePhrases = failurePhrases == null ? List.of() : List.copyOf(failurePhrases);
        successPhrases = successPhrases == null ? List.of() : List.copyOf(successPhrases);
    }

    public Path credentialsFileOrDefault() {
        return credentialsFile != null ? credentialsFile :
                Path.of(System.getProperty("user.home"), ".scraper", "credentials.json");
    }
}
