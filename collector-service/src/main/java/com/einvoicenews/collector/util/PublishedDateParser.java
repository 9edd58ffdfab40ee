package com.einvoicenews.collector.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort publication date extraction from the strings news sites put next to headlines.
 * Local dates and date-times without an offset are read as UTC.
 */
public class PublishedDateParser {

    private static final Pattern LABEL = Pattern.compile(
            "^(published|posted|updated|date)(\\s+on)?\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDINAL = Pattern.compile("(\\d{1,2})(st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE = Pattern.compile(
            "(\\d+)\\s*(min|minute|hour|hr|day|week|month)s?\\s+ago", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMBEDDED_ISO_DATE = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b");

    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATS = List.of(
            english("MMMM d, uuuu"),
            english("MMM d, uuuu"),
            english("MMMM d uuuu"),
            english("MMM d uuuu"),
            english("d MMMM uuuu"),
            english("d MMM uuuu"),
            english("d MMMM, uuuu"),
            english("EEEE, MMMM d, uuuu"),
            english("EEE, MMM d, uuuu"),
            english("dd/MM/uuuu"),
            english("d/M/uuuu"),
            english("dd-MM-uuuu"),
            english("dd.MM.uuuu"),
            english("uuuu/MM/dd")
    );

    private final Clock clock;

    public PublishedDateParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = TextNormalizer.clean(raw);
        text = LABEL.matcher(text).replaceFirst("");
        text = ORDINAL.matcher(text).replaceAll("$1");

        Optional<Instant> iso = parseIso(text);
        if (iso.isPresent()) {
            return iso;
        }

        try {
            return Optional.of(ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException ignored) {
            // not RFC-1123, try the next family
        }

        for (DateTimeFormatter format : LOCAL_DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format).atStartOfDay(ZoneOffset.UTC).toInstant());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }

        Optional<Instant> relative = parseRelative(text);
        if (relative.isPresent()) {
            return relative;
        }

        Matcher embedded = EMBEDDED_ISO_DATE.matcher(text);
        if (embedded.find()) {
            return parseIso(embedded.group(1));
        }
        return Optional.empty();
    }

    private Optional<Instant> parseRelative(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();
        if (lower.equals("today") || lower.equals("just now")) {
            return Optional.of(now);
        }
        if (lower.equals("yesterday")) {
            return Optional.of(now.minus(Duration.ofDays(1)));
        }
        Matcher m = RELATIVE.matcher(lower);
        if (!m.find()) {
            return Optional.empty();
        }
        long value = Long.parseLong(m.group(1));
        Duration ago = switch (m.group(2)) {
            case "min", "minute" -> Duration.ofMinutes(value);
            case "hour", "hr" -> Duration.ofHours(value);
            case "day" -> Duration.ofDays(value);
            case "week" -> Duration.ofDays(value * 7);
            default -> Duration.ofDays(value * 30);
        };
        return Optional.of(now.minus(ago));
    }

    /**
     * ISO-8601 instant, offset date-time, local date-time or local date.
     */
    public static Optional<Instant> parseIso(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.strip();
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset
        }
        try {
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // no time part
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter english(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
