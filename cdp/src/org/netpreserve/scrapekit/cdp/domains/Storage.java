package org.netpreserve.scrapekit.cdp.domains;

import org.netpreserve.scrapekit.cdp.protocol.Unwrap;

import java.util.List;

/**
 * Cookie access scoped to a browser context.
 */
public interface Storage {
    @Unwrap("cookies")
    List<Network.Cookie> getCookies(String browserContextId);

    void setCookies(List<Network.CookieParam> cookies, String browserContextId);

    void clearCookies(String browserContextId);
}
