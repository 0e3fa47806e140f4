package org.netpreserve.scrapekit.config;

import org.netpreserve.scrapekit.ConfigurationException;

import java.net.InetSocketAddress;
import java.net.URI;

/**
 * Outbound proxy used by both transports.
 *
 * @param enabled  whether to use the proxy at all
 * @param server   proxy URL such as {@code http://proxy.example:3128}
 * @param username proxy username, if the proxy requires authentication
 * @param password proxy password
 */
public record ProxyConfig(boolean enabled, String server, String username, String password) {
    public static final ProxyConfig DISABLED = new ProxyConfig(false, null, null, null);

    public ProxyConfig {
        if (enabled && (server == null || server.isBlank())) {
            throw new ConfigurationException("proxy.server is required when the proxy is enabled");
        }
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    public URI serverUri() {
        URI uri = URI.create(server.contains("://") ? server : "http://" + server);
        if (uri.getHost() == null) throw new ConfigurationException("Invalid proxy server: " + server);
        return uri;
    }

    public InetSocketAddress address() {
        URI uri = serverUri();
        int port = uri.getPort() != -1 ? uri.getPort() : "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }

    @Override
    public String toString() {
        return "ProxyConfig[enabled=" + enabled + ", server=" + server + ", username=" + username +
               ", password=" + (password == null ? null : "****") + "]";
    }
}
