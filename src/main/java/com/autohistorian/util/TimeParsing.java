package com.autohistorian.util;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Lenient ISO-8601 parsing for timestamps supplied by the model or the document source.
 */
public final class TimeParsing {
    private TimeParsing() {}

    // +0000 style offsets as sent by the NYT API
    private static final Pattern COMPACT_OFFSET = Pattern.compile("(T[^+-]*[+-]\\d{2})(\\d{2})$");

    private static final DateTimeFormatter ISO_FLEXIBLE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    /**
     * Parse an ISO-8601 timestamp. A trailing {@code Z} and compact offsets such as {@code +0000}
     * are rewritten to {@code +00:00}; local date-times and plain dates are read as UTC. Returns
     * null for null, blank or unparseable input.
     */
    public static OffsetDateTime parseLenient(String text) {
        if (text == null) return null;
        String t = text.trim();
        if (t.isEmpty() || "null".equalsIgnoreCase(t)) return null;
        if (t.endsWith("Z") || t.endsWith("z")) {
            t = t.substring(0, t.length() - 1) + "+00:00";
        }
        t = COMPACT_OFFSET.matcher(t).replaceFirst("$1:$2");
        try {
            TemporalAccessor parsed = ISO_FLEXIBLE.parseBest(t, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime odt) return odt;
            if (parsed instanceof LocalDateTime ldt) return ldt.atOffset(ZoneOffset.UTC);
            return ((LocalDate) parsed).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
