package org.netpreserve.scrapekit.cdp.domains;

import org.netpreserve.scrapekit.cdp.protocol.Unwrap;

public interface Target {
    /**
     * Creates an isolated context, like an incognito profile, with its own cookies and cache.
     */
    @Unwrap("browserContextId")
    String createBrowserContext(Boolean disposeOnDetach, String proxyServer, String proxyBypassList);

    void disposeBrowserContext(String browserContextId);

    @Unwrap("targetId")
    String createTarget(String url, String browserContextId);

    @Unwrap("sessionId")
    String attachToTarget(String targetId, boolean flatten);

    void closeTarget(String targetId);
}
