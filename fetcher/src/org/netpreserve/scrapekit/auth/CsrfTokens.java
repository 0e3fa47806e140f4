package org.netpreserve.scrapekit.auth;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Optional;

/**
 * Finds anti-forgery tokens that login forms expect to be echoed back.
 */
public final class CsrfTokens {
    private static final List<String> META_NAMES = List.of("csrf-token", "_csrf_token");
    private static final List<String> INPUT_NAMES = List.of("csrf_token", "csrf", "_csrf_token", "_token",
            "authenticity_token", "csrfmiddlewaretoken");
    private static final String DEFAULT_FIELD = "csrf_token";

    /**
     * @param fieldName form field to send the token in
     * @param value     the token
     * @param fromMeta  found in a meta tag, so the site probably also wants it in an {@code X-CSRF-Token} header
     */
    public record CsrfToken(String fieldName, String value, boolean fromMeta) {
        @Override
        public String toString() {
            return "CsrfToken[" + fieldName + ", fromMeta=" + fromMeta + "]";
        }
    }

    private CsrfTokens() {
    }

    public static Optional<CsrfToken> find(Document document) {
        for (String name : META_NAMES) {
            Element meta = document.selectFirst("meta[name=" + name + "][content]");
            if (meta != null && !meta.attr("content").isEmpty()) {
                Element param = document.selectFirst("meta[name=csrf-param][content]");
                String field = param != null && !param.attr("content").isEmpty() ? param.attr("content") : DEFAULT_FIELD;
                return Optional.of(new CsrfToken(field, meta.attr("content"), true));
            }
        }
        for (String name : INPUT_NAMES) {
            Element input = document.selectFirst("input[name=" + name + "]");
            if (input != null && !input.val().isEmpty()) {
                return Optional.of(new CsrfToken(name, input.val(), false));
            }
        }
        Element tagged = document.selectFirst("[data-csrf]");
        if (tagged != null && !tagged.attr("data-csrf").isEmpty()) {
            return Optional.of(new CsrfToken(DEFAULT_FIELD, tagged.attr("data-csrf"), false));
        }
        return Optional.empty();
    }
}
