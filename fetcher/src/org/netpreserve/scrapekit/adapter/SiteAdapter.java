package org.netpreserve.scrapekit.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.nodes.Document;
import org.netpreserve.scrapekit.auth.LoginVerdict;

import java.net.URI;

/**
 * Site-specific knowledge: what kind of page a document is, how to pull records out of it and how to tell
 * whether a login worked.
 */
public interface SiteAdapter {
    PageType classifyPage(Document page, URI url);

    JsonNode extractList(Document page, URI url);

    JsonNode extractDetail(Document page, URI url);

    JsonNode extractGeneric(Document page, URI url);

    /**
     * Classifies the page and extracts with the matching method.
     */
    default JsonNode extract(Document page, URI url) {
        return switch (classifyPage(page, url)) {
            case LIST -> extractList(page, url);
            case DETAIL -> extractDetail(page, url);
            case GENERIC -> extractGeneric(page, url);
        };
    }

    /**
     * Judges the page returned by a login submission. {@link LoginVerdict#UNDECIDED} leaves the decision to the
     * generic phrase matching.
     */
    default LoginVerdict verifyLogin(String content) {
        return LoginVerdict.UNDECIDED;
    }
}
