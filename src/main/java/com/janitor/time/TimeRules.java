package com.janitor.time;

import com.janitor.exception.InvalidFormatException;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and rendering of TTL strings and absolute expiry timestamps.
 * <p>
 * TTL format: {@code <integer><unit>} with unit one of s, m, h, d, w, or the literal {@code forever}.
 * <p>
 * Expiry formats, tried in order:
 * <ol>
 *   <li>RFC 3339 ({@code 2024-05-01T10:00:00Z}, {@code 2024-05-01T10:00:00+02:00})</li>
 *   <li>{@code yyyy-MM-dd'T'HH:mm} (UTC)</li>
 *   <li>{@code yyyy-MM-dd} (midnight UTC)</li>
 * </ol>
 */
public final class TimeRules {

    public static final String FOREVER = "forever";

    private static final Pattern TTL_PATTERN = Pattern.compile("^(\\d+)([smhdw])$");

    private static final DateTimeFormatter MINUTE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private static final List<Function<String, Instant>> EXPIRY_FORMATS = List.of(
            TimeRules::parseRfc3339,
            value -> LocalDateTime.parse(value, MINUTE_FORMAT).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    /**
     * Units largest first; the order drives {@link #formatDuration(Duration)}.
     */
    private static final Map<String, Duration> UNITS = new LinkedHashMap<>();

    static {
        UNITS.put("w", Duration.ofDays(7));
        UNITS.put("d", Duration.ofDays(1));
        UNITS.put("h", Duration.ofHours(1));
        UNITS.put("m", Duration.ofMinutes(1));
        UNITS.put("s", Duration.ofSeconds(1));
    }

    private TimeRules() {
    }

    /**
     * Parse a TTL string.
     *
     * @param value TTL string, e.g. "60s", "5m", "8h", "7d", "2w" or "forever"
     * @return Parsed TTL
     * @throws InvalidFormatException if the string matches neither form
     */
    public static Ttl parseTtl(String value) {
        if (FOREVER.equals(value)) {
            return Ttl.FOREVER;
        }
        if (value == null) {
            throw new InvalidFormatException(null, "TTL value is missing");
        }

        Matcher matcher = TTL_PATTERN.matcher(value);
        if (!matcher.matches()) {
            throw new InvalidFormatException(value, "TTL value \"" + value
                    + "\" does not match format (e.g. 60s, 5m, 8h, 7d, 2w)");
        }

        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidFormatException(value, "TTL value \"" + value + "\" is out of range");
        }

        Duration unit = UNITS.get(matcher.group(2));
        try {
            return Ttl.of(value, unit.multipliedBy(amount));
        } catch (ArithmeticException e) {
            throw new InvalidFormatException(value, "TTL value \"" + value + "\" is out of range");
        }
    }

    /**
     * Parse an absolute expiry timestamp.
     *
     * @param value Timestamp in one of the supported formats
     * @return The instant the value denotes
     * @throws InvalidFormatException if no format matches
     */
    public static Instant parseExpiry(String value) {
        if (value == null) {
            throw new InvalidFormatException(null, "expiry value is missing");
        }
        for (Function<String, Instant> format : EXPIRY_FORMATS) {
            Instant instant = tryParse(format, value);
            if (instant != null) {
                return instant;
            }
        }
        throw new InvalidFormatException(value, "expiry value \"" + value
                + "\" does not match any supported format");
    }

    /**
     * Parse a strict RFC 3339 timestamp, as used by the deployment-time annotation.
     *
     * @return The instant, or null when the value does not parse
     */
    public static Instant parseRfc3339OrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return tryParse(TimeRules::parseRfc3339, value);
    }

    private static Instant tryParse(Function<String, Instant> format, String value) {
        try {
            return format.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseRfc3339(String value) {
        return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    /**
     * Render a duration largest unit first, e.g. 5400s becomes "1h30m".
     * Zero renders as "0s"; negative durations get a leading "-".
     */
    public static String formatDuration(Duration duration) {
        if (duration.isNegative()) {
            return "-" + formatDuration(duration.negated());
        }

        StringBuilder sb = new StringBuilder();
        long remaining = duration.getSeconds();
        for (Map.Entry<String, Duration> unit : UNITS.entrySet()) {
            long unitSeconds = unit.getValue().getSeconds();
            long value = remaining / unitSeconds;
            if (value > 0) {
                sb.append(value).append(unit.getKey());
                remaining = remaining % unitSeconds;
            }
        }

        return sb.length() == 0 ? "0s" : sb.toString();
    }

    /**
     * Format an instant as RFC 3339 in UTC, second precision.
     */
    public static String formatInstant(Instant instant) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                instant.truncatedTo(ChronoUnit.SECONDS).atOffset(ZoneOffset.UTC));
    }
}
