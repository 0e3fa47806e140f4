package org.netpreserve.scrapekit.fetch;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * A cookie in a form both transports understand, so a session captured by one engine can be restored into
 * another.
 *
 * @param expires null for session cookies
 */
public record SessionCookie(String name, String value, String domain, String path, @Nullable Instant expires,
                            boolean secure, boolean httpOnly) {
    public SessionCookie {
        if (path == null || path.isEmpty()) path = "/";
    }

    public boolean isExpired(Instant now) {
        return expires != null && !expires.isAfter(now);
    }

    /**
     * Whether the two cookies occupy the same slot in a cookie jar.
     */
    public boolean sameSlot(SessionCookie other) {
        return name.equals(other.name) && domainKey().equals(other.domainKey()) && path.equals(other.path);
    }

    private String domainKey() {
        return domain == null ? "" : domain.startsWith(".") ? domain.substring(1) : domain;
    }

    @Override
    public String toString() {
        return "SessionCookie[" + name + "=****; domain=" + domain + "; path=" + path + "]";
    }
}
