package org.netpreserve.scrapekit.fetch;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.config.BrowserConfig;
import org.netpreserve.scrapekit.config.ProxyConfig;
import org.netpreserve.scrapekit.config.ScraperConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Settings shared by both transports.
 *
 * @param headers        extra headers for every request
 * @param userAgent      User-Agent for this session, null to leave the client's default
 * @param proxy          outbound proxy
 * @param connectTimeout limit on establishing connections
 * @param browser        browser launch settings, ignored by the HTTP transport
 */
public record TransportSettings(Map<String, String> headers, @Nullable String userAgent, ProxyConfig proxy,
                                Duration connectTimeout, BrowserConfig browser) {
    public TransportSettings {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (proxy == null) proxy = ProxyConfig.DISABLED;
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(30);
        if (browser == null) browser = new BrowserConfig(null, null, true);
    }

    public static TransportSettings from(ScraperConfig config) {
        String userAgent = config.userAgentRotation() ? UserAgents.random() : config.userAgent();
        return new TransportSettings(config.headers(), userAgent, config.proxy(), config.timeout(), config.browser());
    }
}
