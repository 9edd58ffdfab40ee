package com.einvoicenews.collector.util;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Boolean keyword relevance checks used by adapters.
 */
public final class RelevanceFilter {

    public static final List<String> EINVOICE_KEYWORDS = List.of(
            "e-invoice", "einvoice", "e-invoicing", "einvoicing",
            "electronic invoice", "electronic invoicing",
            "e-receipt", "digital invoice", "tax invoice",
            "zatca", "fatoorah", "fta", "vat", "gst",
            "peppol", "ubl", "xrechnung", "factur-x",
            "sdi", "chorus pro", "ksef", "cfdi", "nf-e",
            "b2b invoice", "b2g invoice", "clearance",
            "tax compliance", "tax digitalization"
    );

    private RelevanceFilter() {}

    public static boolean isEInvoiceRelated(String title, String summary) {
        return containsAny(title, summary, EINVOICE_KEYWORDS);
    }

    public static boolean containsAny(String title, String summary, Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return false;
        }
        String text = ((title != null ? title : "") + " " + (summary != null ? summary : "")).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
