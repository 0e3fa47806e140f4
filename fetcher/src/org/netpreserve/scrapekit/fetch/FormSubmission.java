package org.netpreserve.scrapekit.fetch;

import org.netpreserve.scrapekit.auth.Credentials;
import org.netpreserve.scrapekit.auth.FieldMap;

import java.net.URI;

/**
 * A login form to fill in and submit.
 *
 * @param pageUrl     where the form was found (final URL of the login page)
 * @param pageContent the login page as retrieved, used by the HTTP transport to find field names and tokens
 * @param fields      locators for the form's fields
 * @param credentials values to fill in
 */
public record FormSubmission(URI pageUrl, String pageContent, FieldMap fields, Credentials credentials) {
}
