package com.einvoicenews.collector.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-based country detection for multi-country sources such as aggregators.
 * The first country in table order with a matching keyword wins.
 */
public final class CountryDetector {

    public record CountryMatch(String country, String countryName, String region) {

        public static final CountryMatch GLOBAL = new CountryMatch(null, "Global", "global");

        public boolean isGlobal() {
            return country == null;
        }
    }

    private record Country(String name, String region, List<String> keywords) {}

    private static final Map<String, Country> COUNTRIES = new LinkedHashMap<>();

    static {
        // Middle East
        put("SA", "Saudi Arabia", "middle-east", "saudi", "zatca", "ksa", "fatoorah");
        put("AE", "UAE", "middle-east", "uae", "emirates", "dubai", "fta ");
        put("EG", "Egypt", "middle-east", "egypt", "egyptian", "eta ");
        put("BH", "Bahrain", "middle-east", "bahrain");
        put("OM", "Oman", "middle-east", "oman");
        put("QA", "Qatar", "middle-east", "qatar");
        put("KW", "Kuwait", "middle-east", "kuwait");
        put("JO", "Jordan", "middle-east", "jordan");
        // Europe
        put("EU", "European Union", "europe", "european union", "eu ", "vida", "european commission");
        put("DE", "Germany", "europe", "germany", "german", "xrechnung", "zugferd");
        put("FR", "France", "europe", "france", "french", "chorus pro", "factur-x");
        put("IT", "Italy", "europe", "italy", "italian", "sdi ");
        put("ES", "Spain", "europe", "spain", "spanish", "verifactu", "ticketbai");
        put("PL", "Poland", "europe", "poland", "polish", "ksef");
        put("BE", "Belgium", "europe", "belgium", "belgian");
        put("NL", "Netherlands", "europe", "netherlands", "dutch");
        put("PT", "Portugal", "europe", "portugal", "portuguese", "saf-t");
        put("GR", "Greece", "europe", "greece", "greek", "mydata");
        put("RO", "Romania", "europe", "romania", "romanian");
        put("HR", "Croatia", "europe", "croatia", "croatian");
        // Americas
        put("BR", "Brazil", "americas", "brazil", "brazilian", "nf-e", "nfe");
        put("MX", "Mexico", "americas", "mexico", "mexican", "cfdi");
        put("CL", "Chile", "americas", "chile", "chilean", "dte");
        put("CO", "Colombia", "americas", "colombia", "colombian", "dian");
        put("AR", "Argentina", "americas", "argentina");
        // Asia-Pacific
        put("IN", "India", "asia-pacific", "india", "indian", "gst", "gstn");
        put("AU", "Australia", "asia-pacific", "australia", "australian");
        put("SG", "Singapore", "asia-pacific", "singapore");
        put("MY", "Malaysia", "asia-pacific", "malaysia", "myinvois");
        put("VN", "Vietnam", "asia-pacific", "vietnam");
        put("PH", "Philippines", "asia-pacific", "philippines", "eis");
        put("CN", "China", "asia-pacific", "china", "chinese", "fapiao");
        // Africa
        put("KE", "Kenya", "africa", "kenya", "kenyan", "tims");
        put("NG", "Nigeria", "africa", "nigeria", "nigerian");
        put("ZA", "South Africa", "africa", "south africa");
    }

    private CountryDetector() {}

    private static void put(String code, String name, String region, String... keywords) {
        COUNTRIES.put(code, new Country(name, region, List.of(keywords)));
    }

    public static CountryMatch detect(String title, String summary) {
        String text = ((title != null ? title : "") + " " + (summary != null ? summary : "")).toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Country> entry : COUNTRIES.entrySet()) {
            for (String keyword : entry.getValue().keywords()) {
                if (text.contains(keyword)) {
                    return new CountryMatch(entry.getKey(), entry.getValue().name(), entry.getValue().region());
                }
            }
        }
        return CountryMatch.GLOBAL;
    }
}
