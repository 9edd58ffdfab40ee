package com.einvoicenews.collector.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Accepts only absolute http(s) URLs with a dotted host.
 */
public final class UrlValidator {

    private static final List<String> REJECTED_PREFIXES = List.of("javascript:", "mailto:", "tel:", "void(");

    private UrlValidator() {}

    public static boolean isValid(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String trimmed = url.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("#")) {
            return false;
        }
        for (String prefix : REJECTED_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return false;
            }
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            return false;
        }

        String scheme = uri.getScheme();
        if (scheme == null) {
            return false;
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return false;
        }

        String host = hostOf(uri);
        return host != null && !host.isBlank() && host.contains(".") && !host.startsWith(".");
    }

    // URI.getHost() is null for registry-style authorities such as hosts with underscores
    private static String hostOf(URI uri) {
        if (uri.getHost() != null) {
            return uri.getHost();
        }
        String authority = uri.getRawAuthority();
        if (authority == null) {
            return null;
        }
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        int colon = authority.indexOf(':');
        if (colon >= 0) {
            authority = authority.substring(0, colon);
        }
        return authority;
    }
}
