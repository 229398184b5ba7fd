package com.bhzfootball.agenda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the date/time fragments found upstream into zone-aware timestamps in the configured local zone.
 * <p>
 * Two families of input are handled:
 * <ul>
 *   <li>Fully qualified values (ISO strings, "yyyy-MM-dd HH:mm:ss", epoch seconds). Strings carrying an offset keep the
 *       clock time they report; only the zone label changes.</li>
 *   <li>Partial "day/month" tokens without a year. The year is searched among the years spanned by the caller's window,
 *       in order, and the first candidate inside the window wins. When none fits, the window's start year is used and
 *       the result is flagged {@code yearInferred}.</li>
 * </ul>
 * A missing time becomes 00:00:00 and is flagged {@code timeMissing}.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class DateTimeResolver {
    private static final Logger logger = LoggerFactory.getLogger(DateTimeResolver.class);

    /** Canonical output form: {@code yyyy-MM-dd HH:mm:ss}. */
    public static final DateTimeFormatter CANONICAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Pattern DATE_TOKEN = Pattern.compile("(\\d{1,2})[/.](\\d{1,2})(?:[/.](\\d{2,4}))?");
    private static final Pattern ISO_DATE_TOKEN = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern TIME_TOKEN = Pattern.compile("(\\d{1,2})\\s*[:hH]\\s*(\\d{2})");

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
        DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
        DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm")
    );

    /**
     * Result of a resolution.
     * @param value timestamp in the configured zone
     * @param yearInferred true when no candidate year fell inside the window and the start year was assumed
     * @param timeMissing true when the source gave no time and 00:00 was assumed
     */
    public record ResolvedDateTime(ZonedDateTime value, boolean yearInferred, boolean timeMissing) {
        public LocalDate date() {
            return value.toLocalDate();
        }
    }

    private final ZoneId zone;

    public DateTimeResolver(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Parses a fully qualified timestamp string.
     * @param value raw string (may be null)
     * @return resolved timestamp, or empty when the string is not a recognizable timestamp
     */
    public Optional<ResolvedDateTime> parseTimestamp(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String text = value.trim();
        try {
            OffsetDateTime odt = OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
            return Optional.of(new ResolvedDateTime(odt.toLocalDateTime().atZone(zone), false, false));
        } catch (DateTimeParseException ignored) {
            // not an offset timestamp, try the local forms
        }
        try {
            ZonedDateTime zdt = ZonedDateTime.parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME);
            return Optional.of(new ResolvedDateTime(zdt.withZoneSameLocal(zone), false, false));
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            Optional<LocalDateTime> parsed = tryParse(text, s -> LocalDateTime.parse(s, format));
            if (parsed.isPresent()) {
                return Optional.of(new ResolvedDateTime(parsed.get().atZone(zone), false, false));
            }
        }
        Optional<LocalDate> dateOnly = tryParse(text, s -> LocalDate.parse(s, DateTimeFormatter.ISO_LOCAL_DATE));
        if (dateOnly.isPresent()) {
            logger.warn("No kick-off time reported for {}. Assuming 00:00:00.", text);
            return Optional.of(new ResolvedDateTime(dateOnly.get().atStartOfDay(zone), false, true));
        }
        return Optional.empty();
    }

    /**
     * Converts epoch seconds (an absolute instant) into the configured zone.
     * @return resolved timestamp, or empty when the value lies outside the supported date range
     */
    public Optional<ResolvedDateTime> fromEpochSeconds(long epochSeconds) {
        try {
            return Optional.of(new ResolvedDateTime(Instant.ofEpochSecond(epochSeconds).atZone(zone), false, false));
        } catch (DateTimeException e) {
            logger.warn("Epoch value {} out of range: {}", epochSeconds, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Builds a timestamp from a date token and an optional time token.
     * @param dateToken "dd/MM", "dd.MM", "dd/MM/yyyy" or "yyyy-MM-dd", possibly surrounded by other text
     * @param timeToken "HH:mm" or "HHhmm", may be null
     * @param from window start, inclusive
     * @param to window end, inclusive
     * @return resolved timestamp, or empty when the tokens cannot form a valid date
     */
    public Optional<ResolvedDateTime> resolve(String dateToken, String timeToken, LocalDate from, LocalDate to) {
        if (dateToken == null || dateToken.isBlank()) return Optional.empty();

        LocalTime time = parseTime(timeToken);
        boolean timeMissing = time == null;
        if (timeMissing) time = LocalTime.MIDNIGHT;

        Matcher iso = ISO_DATE_TOKEN.matcher(dateToken);
        if (iso.find()) {
            return build(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3)), time)
                .map(dt -> flagged(dt, false, timeMissing, dateToken));
        }
        Matcher m = DATE_TOKEN.matcher(dateToken);
        if (!m.find()) {
            logger.debug("Unrecognized date token '{}'", dateToken);
            return Optional.empty();
        }
        int day = Integer.parseInt(m.group(1));
        int month = Integer.parseInt(m.group(2));
        if (m.group(3) != null) {
            int year = Integer.parseInt(m.group(3));
            if (year < 100) year += 2000;
            return build(year, month, day, time).map(dt -> flagged(dt, false, timeMissing, dateToken));
        }

        for (int year = from.getYear(); year <= to.getYear(); year++) {
            Optional<ZonedDateTime> candidate = build(year, month, day, time);
            if (candidate.isEmpty()) continue;
            LocalDate date = candidate.get().toLocalDate();
            if (!date.isBefore(from) && !date.isAfter(to)) {
                return Optional.of(flagged(candidate.get(), false, timeMissing, dateToken));
            }
        }
        Optional<ZonedDateTime> fallback = build(from.getYear(), month, day, time);
        if (fallback.isEmpty()) {
            logger.warn("Invalid date token '{}' ignored.", dateToken);
            return Optional.empty();
        }
        return Optional.of(flagged(fallback.get(), true, timeMissing, dateToken));
    }

    /**
     * Formats a timestamp in the canonical form, in the configured zone.
     */
    public String format(ZonedDateTime value) {
        return value.withZoneSameInstant(zone).format(CANONICAL_FORMAT);
    }

    /**
     * Re-parses any accepted timestamp string and formats it canonically.
     * @throws IllegalArgumentException when the string is not a timestamp
     */
    public String renormalize(String value) {
        return parseTimestamp(value)
            .map(r -> format(r.value()))
            .orElseThrow(() -> new IllegalArgumentException("Unparseable datetime '" + value + "'"));
    }

    private ResolvedDateTime flagged(ZonedDateTime value, boolean yearInferred, boolean timeMissing, String token) {
        if (yearInferred) {
            logger.info("Year for '{}' not confirmed by the window. Assuming {}.", token, value.getYear());
        }
        if (timeMissing) {
            logger.warn("No kick-off time reported for {}. Assuming 00:00:00.", value.toLocalDate());
        }
        return new ResolvedDateTime(value, yearInferred, timeMissing);
    }

    private Optional<ZonedDateTime> build(int year, int month, int day, LocalTime time) {
        try {
            return Optional.of(LocalDate.of(year, month, day).atTime(time).atZone(zone));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static LocalTime parseTime(String token) {
        if (token == null || token.isBlank()) return null;
        Matcher m = TIME_TOKEN.matcher(token);
        if (!m.find()) return null;
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) return null;
        return LocalTime.of(hour, minute);
    }

    private static <T> Optional<T> tryParse(String text, Function<String, T> parser) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
