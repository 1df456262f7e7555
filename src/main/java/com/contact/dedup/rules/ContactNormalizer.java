package com.contact.dedup.rules;

import com.contact.dedup.core.model.ContactRecord;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical forms for the identifying contact fields.
 * Every method returns null when the input carries no usable value.
 */
public final class ContactNormalizer {

    private static final Pattern SCHEME = Pattern.compile("^[a-z][a-z0-9+.\\-]*://");
    private static final Pattern WWW = Pattern.compile("^www\\.");
    private static final Pattern PORT = Pattern.compile(":\\d*$");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern TRAILING_SLASHES = Pattern.compile("/+$");

    private ContactNormalizer() {
        // Utility class
    }

    /**
     * Trimmed, lower-cased email address.
     */
    public static String normalizeEmail(String email) {
        if (isBlank(email)) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts a bare host from an email address (part after the last {@code @})
     * or from a URL (scheme, {@code www.}, path, query and port removed).
     */
    public static String extractDomain(String emailOrUrl) {
        if (isBlank(emailOrUrl)) {
            return null;
        }
        String value = emailOrUrl.trim().toLowerCase(Locale.ROOT);
        int at = value.lastIndexOf('@');
        if (at >= 0) {
            value = value.substring(at + 1);
        }
        value = SCHEME.matcher(value).replaceFirst("");
        value = WWW.matcher(value).replaceFirst("");
        int end = indexOfAny(value, '/', '?', '#');
        if (end >= 0) {
            value = value.substring(0, end);
        }
        value = PORT.matcher(value).replaceFirst("");
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
    }

    /**
     * The domain used for matching: the explicit domain if present, otherwise the
     * email domain, otherwise the website host.
     */
    public static String domainOf(ContactRecord record) {
        String domain = extractDomain(record.getDomain());
        if (domain == null) {
            domain = extractDomain(record.getEmail());
        }
        if (domain == null) {
            domain = extractDomain(record.getWebsite());
        }
        return domain;
    }

    /**
     * Profile URL without scheme, {@code www.} and trailing slashes, lower-cased.
     */
    public static String normalizeProfileUrl(String url) {
        if (isBlank(url)) {
            return null;
        }
        String value = url.trim().toLowerCase(Locale.ROOT);
        value = SCHEME.matcher(value).replaceFirst("");
        value = WWW.matcher(value).replaceFirst("");
        value = TRAILING_SLASHES.matcher(value).replaceFirst("");
        return value.isEmpty() ? null : value;
    }

    /**
     * Digits only; {@code "+1 (555) 123-4567"} becomes {@code "15551234567"}.
     */
    public static String normalizePhone(String phone) {
        if (isBlank(phone)) {
            return null;
        }
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        return digits.isEmpty() ? null : digits;
    }

    private static int indexOfAny(String value, char... chars) {
        int min = -1;
        for (char c : chars) {
            int idx = value.indexOf(c);
            if (idx >= 0 && (min < 0 || idx < min)) {
                min = idx;
            }
        }
        return min;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
