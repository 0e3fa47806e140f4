package org.netpreserve.scrapekit.auth;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.ConfigurationException;

import java.util.Map;

/**
 * CSS selectors locating the login form's fields.
 *
 * @param username selector of the username input
 * @param password selector of the password input
 * @param submit   selector of the submit button, null to fall back to the form's first submit button
 * @param action   URL (absolute or relative to the login page) to post to instead of the form's own action
 */
public record FieldMap(String username, String password, @Nullable String submit, @Nullable String action) {
    public FieldMap {
        if (username == null || username.isBlank()) {
            throw new ConfigurationException("Login field map is missing the username locator");
        }
        if (password == null || password.isBlank()) {
            throw new ConfigurationException("Login field map is missing the password locator");
        }
        if (submit != null && submit.isBlank()) submit = null;
        if (action != null && action.isBlank()) action = null;
    }

    /**
     * Builds a field map from configuration keys {@code username}, {@code password}, {@code submit} and
     * {@code action}.
     */
    public static FieldMap of(Map<String, String> fields) {
        for (String key : fields.keySet()) {
            if (!key.equals("username") && !key.equals("password") && !key.equals("submit") && !key.equals("action")) {
                throw new ConfigurationException("Unknown login field '" + key + "'");
            }
        }
        return new FieldMap(fields.get("username"), fields.get("password"), fields.get("submit"), fields.get("action"));
    }
}
