package org.netpreserve.scrapekit.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

public interface Network {
    void enable();

    void setExtraHTTPHeaders(Map<String, String> headers);

    void setUserAgentOverride(String userAgent);

    void onResponseReceived(Consumer<ResponseReceived> handler);

    record ResponseReceived(RequestId requestId, LoaderId loaderId, String type, Response response,
                            Page.FrameId frameId) {
    }

    record Response(String url, int status, String statusText, String mimeType) {
    }

    record RequestId(@JsonValue String value) {
        @JsonCreator
        public RequestId {
            Objects.requireNonNull(value);
        }
    }

    record LoaderId(@JsonValue String value) {
        @JsonCreator
        public LoaderId {
            Objects.requireNonNull(value);
        }
    }

    /**
     * A cookie as reported by the browser. {@code expires} is seconds since the epoch, or -1 for session cookies.
     */
    record Cookie(String name, String value, String domain, String path, double expires, boolean httpOnly,
                  boolean secure, boolean session, String sameSite) {
    }

    record CookieParam(String name, String value, String domain, String path, Boolean secure, Boolean httpOnly,
                       Double expires) {
    }
}
