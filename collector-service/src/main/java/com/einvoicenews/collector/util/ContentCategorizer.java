package com.einvoicenews.collector.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword categories. At most two, in table order, "update" when nothing matches.
 */
public final class ContentCategorizer {

    public static final int MAX_CATEGORIES = 2;
    public static final String DEFAULT_CATEGORY = "update";

    private static final Map<String, List<String>> CATEGORY_KEYWORDS = new LinkedHashMap<>();

    static {
        CATEGORY_KEYWORDS.put("mandate", List.of("mandate", "mandatory", "required", "obligation", "compulsory"));
        CATEGORY_KEYWORDS.put("regulation", List.of("regulation", "regulatory", "law", "legislation", "directive", "framework"));
        CATEGORY_KEYWORDS.put("deadline", List.of("deadline", "due date", "effective date", "implementation date", "timeline"));
        CATEGORY_KEYWORDS.put("partnership", List.of("partner", "partnership", "collaboration", "alliance", "joint"));
        CATEGORY_KEYWORDS.put("product", List.of("launch", "release", "new feature", "solution", "platform", "tool", "product"));
        CATEGORY_KEYWORDS.put("compliance", List.of("compliance", "compliant", "certified", "certification", "audit"));
        CATEGORY_KEYWORDS.put("expansion", List.of("expand", "expansion", "new office", "new market", "growth"));
        CATEGORY_KEYWORDS.put("update", List.of("update", "change", "modification", "amendment", "revision"));
    }

    private ContentCategorizer() {}

    public static List<String> categorize(String title, String summary) {
        String text = ((title != null ? title : "") + " " + (summary != null ? summary : "")).toLowerCase(Locale.ROOT);
        List<String> categories = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : CATEGORY_KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(text::contains)) {
                categories.add(entry.getKey());
                if (categories.size() == MAX_CATEGORIES) {
                    break;
                }
            }
        }
        if (categories.isEmpty()) {
            categories.add(DEFAULT_CATEGORY);
        }
        return List.copyOf(categories);
    }

    /**
     * Distinct, non-blank, trimmed, capped at two.
     */
    public static List<String> sanitize(List<String> categories) {
        if (categories == null) {
            return List.of();
        }
        return categories.stream()
                .filter(c -> c != null && !c.isBlank())
                .map(String::strip)
                .distinct()
                .limit(MAX_CATEGORIES)
                .toList();
    }
}
