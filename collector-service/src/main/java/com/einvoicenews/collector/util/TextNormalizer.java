package com.einvoicenews.collector.util;

import org.jsoup.Jsoup;
import org.jsoup.parser.Parser;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text clean-up shared by adapters and the dedup engine.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private TextNormalizer() {}

    /**
     * Decodes HTML entities, collapses whitespace and trims.
     */
    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String unescaped = Parser.unescapeEntities(text, false);
        return WHITESPACE.matcher(unescaped).replaceAll(" ").strip();
    }

    /**
     * Visible text of an HTML fragment, cleaned.
     */
    public static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return clean(Jsoup.parse(html).text());
    }

    /**
     * Cuts to at most maxLength characters on a word boundary and appends "...".
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        String cut = text.substring(0, maxLength);
        int lastSpace = cut.lastIndexOf(' ');
        if (lastSpace > 0) {
            cut = cut.substring(0, lastSpace);
        }
        return cut + "...";
    }

    /**
     * Comparison key: trimmed and lower-cased.
     */
    public static String key(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
