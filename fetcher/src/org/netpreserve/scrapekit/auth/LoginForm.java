package org.netpreserve.scrapekit.auth;

import org.jetbrains.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.netpreserve.scrapekit.ConfigurationException;
import org.netpreserve.scrapekit.fetch.FormSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A login form worked out from the login page's HTML, ready to be sent without a browser.
 *
 * @param action  where to send the form
 * @param method  {@code POST} or {@code GET}
 * @param fields  form fields in document order: hidden inputs, CSRF token, username, password, submit button
 * @param headers extra request headers (the CSRF header when the token came from a meta tag)
 */
public record LoginForm(URI action, String method, Map<String, String> fields, Map<String, String> headers) {
    private static final Logger log = LoggerFactory.getLogger(LoginForm.class);
    private static final Pattern BARE_NAME = Pattern.compile("[\\w\\-\\[\\].]+");
    public static final String CSRF_HEADER = "X-CSRF-Token";

    public static LoginForm from(FormSubmission submission) {
        URI pageUrl = submission.pageUrl();
        FieldMap fieldMap = submission.fields();
        Document document = Jsoup.parse(submission.pageContent(), pageUrl.toString());

        Element passwordInput = select(document, fieldMap.password());
        Element form = passwordInput != null ? enclosingForm(passwordInput) : null;
        if (form == null) form = document.selectFirst("form");

        var fields = new LinkedHashMap<String, String>();
        var headers = new LinkedHashMap<String, String>();
        if (form != null) {
            for (Element hidden : form.select("input[type=hidden][name]")) {
                fields.put(hidden.attr("name"), hidden.val());
            }
        }
        CsrfTokens.find(document).ifPresentOrElse(token -> {
            fields.putIfAbsent(token.fieldName(), token.value());
            if (token.fromMeta()) headers.put(CSRF_HEADER, token.value());
            log.debug("Found {} on {}", token, pageUrl);
        }, () -> log.debug("No CSRF token on {}", pageUrl));

        fields.put(fieldName(document, fieldMap.username(), "username"), submission.credentials().username());
        fields.put(fieldName(document, fieldMap.password(), "password"), submission.credentials().secret());
        if (fieldMap.submit() != null) {
            Element button = select(document, fieldMap.submit());
            if (button != null && button.hasAttr("name")) fields.put(button.attr("name"), button.val());
        }

        URI action;
        if (fieldMap.action() != null) {
            action = resolve(pageUrl, fieldMap.action());
        } else if (form != null && !form.attr("action").isBlank()) {
            action = resolve(pageUrl, form.attr("action"));
        } else {
            action = pageUrl;
        }
        String method = form != null && form.attr("method").equalsIgnoreCase("get") ? "GET" : "POST";
        return new LoginForm(action, method, Collections.unmodifiableMap(fields), Collections.unmodifiableMap(headers));
    }

    private static URI resolve(URI pageUrl, String reference) {
        try {
            return pageUrl.resolve(reference.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid login form action: " + reference, e);
        }
    }

    @Nullable
    private static Element select(Document document, String locator) {
        try {
            return document.selectFirst(locator);
        } catch (Selector.SelectorParseException e) {
            return null;
        }
    }

    @Nullable
    private static Element enclosingForm(Element element) {
        for (Element parent : element.parents()) {
            if (parent.normalName().equals("form")) return parent;
        }
        return null;
    }

    /**
     * Works out the name a locator's input is submitted under: the element's name attribute, else the id in an
     * {@code #id} locator, else the locator itself if it looks like a plain field name.
     */
    static String fieldName(Document document, String locator, String logicalName) {
        Element element = select(document, locator);
        if (element != null && !element.attr("name").isEmpty()) return element.attr("name");
        if (locator.startsWith("#") && BARE_NAME.matcher(locator.substring(1)).matches()) return locator.substring(1);
        if (BARE_NAME.matcher(locator).matches() && !locator.toLowerCase(Locale.ROOT).equals("input")) return locator;
        return logicalName;
    }

    @Override
    public String toString() {
        return "LoginForm[" + method + " " + action + ", fields=" + fields.keySet() + "]";
    }
}
