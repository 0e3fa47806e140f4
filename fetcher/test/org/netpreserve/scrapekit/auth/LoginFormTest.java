package org.netpreserve.scrapekit.auth;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;
import org.netpreserve.scrapekit.fetch.FormSubmission;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoginFormTest {
    private static final URI PAGE = URI.create("https://example.org/account/login");
    private static final Credentials ALICE = new Credentials("alice", "s3cret");

    private static LoginForm form(String html, FieldMap fields) {
        return LoginForm.from(new FormSubmission(PAGE, html, fields, ALICE));
    }

    @Test
    void buildsPostFromTheFormHoldingThePasswordField() {
        String html = """
                <form action=/search method=get><input name=q></form>
                <form action="session" method="post">
                  <input type=hidden name=return_to value="/home">
                  <input type=hidden name=authenticity_token value=tok123>
                  <input id=user name=login>
                  <input id=pass name=pw type=password>
                  <button id=go name=commit value="Sign in">Sign in</button>
                </form>""";
        var form = form(html, new FieldMap("#user", "#pass", "#go", null));

        assertEquals(URI.create("https://example.org/account/session"), form.action());
        assertEquals("POST", form.method());
        assertEquals(List.of("return_to", "authenticity_token", "login", "pw", "commit"),
                List.copyOf(form.fields().keySet()));
        assertEquals("tok123", form.fields().get("authenticity_token"));
        assertEquals("alice", form.fields().get("login"));
        assertEquals("s3cret", form.fields().get("pw"));
        assertEquals("Sign in", form.fields().get("commit"));
        assertTrue(form.headers().isEmpty());
        assertFalse(form.toString().contains("s3cret"));
    }

    @Test
    void metaTokenIsSentAsFieldAndHeader() {
        String html = """
                <head><meta name=csrf-token content=abc></head>
                <form><input id=u name=user><input id=p name=pass type=password></form>""";
        var form = form(html, new FieldMap("#u", "#p", null, "/api/login"));

        assertEquals(URI.create("https://example.org/api/login"), form.action());
        assertEquals(Map.of(LoginForm.CSRF_HEADER, "abc"), form.headers());
        assertEquals("abc", form.fields().get("csrf_token"));
    }

    @Test
    void noFormPostsBackToThePage() {
        var form = form("<p>nothing here</p>", new FieldMap("#email", "#password", null, null));
        assertEquals(PAGE, form.action());
        assertEquals(Map.of("email", "alice", "password", "s3cret"), form.fields());
    }

    @Test
    void fieldNameFallbacks() {
        var document = Jsoup.parse("<input class=login-name name=uname><input class=pw>");
        assertEquals("uname", LoginForm.fieldName(document, ".login-name", "username"));
        assertEquals("password", LoginForm.fieldName(document, "input[class=pw]", "password"));
        assertEquals("user_email", LoginForm.fieldName(document, "#user_email", "username"));
        assertEquals("email", LoginForm.fieldName(document, "email", "username"));
        assertEquals("username", LoginForm.fieldName(document, "input[type=text", "username"));
    }
}
