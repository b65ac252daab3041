package com.hting007.logiq.parse;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the timestamp at the head of a log line, for placing replayed lines in windows.
 *
 * <p>Accepted heads, optionally wrapped in {@code [ ]}:
 * <pre>
 * 2026-02-01 10:00:02          (local time, zone supplied by the caller)
 * 2026-02-01T10:00:02.123      (local time)
 * 2026-01-28T10:30:01Z         (instant / offset)
 * </pre>
 */
public final class LogLineTimestamps {

    private static final Pattern HEAD = Pattern.compile(
            "^\\s*\\[?(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:[.,]\\d{1,9})?(Z|[+-]\\d{2}:?\\d{2})?)\\]?");

    private static final DateTimeFormatter LOCAL = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .toFormatter();

    private final ZoneId zone;

    public LogLineTimestamps(ZoneId zone) {
        this.zone = zone;
    }

    public Optional<Instant> read(String line) {
        if (line == null) return Optional.empty();
        Matcher m = HEAD.matcher(line);
        if (!m.find()) return Optional.empty();

        String text = m.group(1).replace(',', '.');
        try {
            if (m.group(2) != null) {
                String iso = text.replace(' ', 'T');
                if (iso.endsWith("Z")) return Optional.of(Instant.parse(iso));
                return Optional.of(OffsetDateTime.parse(normalizeOffset(iso)).toInstant());
            }
            return Optional.of(LocalDateTime.parse(text.replace('T', ' '), LOCAL).atZone(zone).toInstant());
        } catch (DateTimeParseException e) {
            // looks like a timestamp but is not a valid date (e.g. month 13)
            return Optional.empty();
        }
    }

    // +0100 -> +01:00
    private static String normalizeOffset(String iso) {
        int len = iso.length();
        char sign = iso.charAt(len - 5);
        if ((sign == '+' || sign == '-') && iso.charAt(len - 3) != ':') {
            return iso.substring(0, len - 2) + ":" + iso.substring(len - 2);
        }
        return iso;
    }
}
