package com.bhzfootball.agenda;

import com.bhzfootball.agenda.extract.RawEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Projects a {@link RawEvent} into the canonical {@link NormalizedFixture} schema.
 * <p>
 * Records without both team names or without a resolvable timestamp are dropped (empty result), never emitted with
 * placeholder values. Window filtering is left to the caller.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class FixtureNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(FixtureNormalizer.class);

    public static final String DEFAULT_STATUS = "scheduled";

    private final TeamCanonicalizer canonicalizer;
    private final DateTimeResolver resolver;

    public FixtureNormalizer(TeamCanonicalizer canonicalizer, DateTimeResolver resolver) {
        this.canonicalizer = canonicalizer;
        this.resolver = resolver;
    }

    /**
     * Normalizes one raw event.
     * @param event raw event from any strategy
     * @param source source tag written to {@code source} and hashed into the external id
     * @param fallbackCompetition competition label used when the event has none
     * @param from window start, used to pick the year of partial dates
     * @param to window end, used to pick the year of partial dates
     * @return normalized fixture, or empty when the event is unusable
     */
    public Optional<NormalizedFixture> normalize(RawEvent event, String source, String fallbackCompetition,
                                                 LocalDate from, LocalDate to) {
        if (event == null || !event.hasBothTeams()) {
            logger.debug("Dropping event without both team names: {}", event);
            return Optional.empty();
        }
        Optional<DateTimeResolver.ResolvedDateTime> when = resolveWhen(event, from, to);
        if (when.isEmpty()) {
            logger.warn("Ignoring {} x {} with invalid date ({} / {} / {}).", event.homeTeam(), event.awayTeam(),
                event.startDateTime(), event.dateToken(), event.timeToken());
            return Optional.empty();
        }

        String home = canonicalizer.canonicalize(event.homeTeam());
        String away = canonicalizer.canonicalize(event.awayTeam());
        String datetime = resolver.format(when.get().value());
        String competition = firstNonBlank(event.competition(), fallbackCompetition);
        String venue = firstNonBlank(event.venue(), "");
        String status = firstNonBlank(event.status(), DEFAULT_STATUS);

        return Optional.of(new NormalizedFixture(
            externalId(source, competition, home, away, datetime, venue),
            competition,
            datetime,
            home,
            away,
            venue,
            status,
            source,
            blankToNull(event.season()),
            blankToNull(event.round()),
            event.homeGoals(),
            event.awayGoals()
        ));
    }

    private Optional<DateTimeResolver.ResolvedDateTime> resolveWhen(RawEvent event, LocalDate from, LocalDate to) {
        if (event.epochSeconds() != null) {
            return resolver.fromEpochSeconds(event.epochSeconds());
        }
        Optional<DateTimeResolver.ResolvedDateTime> parsed = resolver.parseTimestamp(event.startDateTime());
        if (parsed.isPresent()) return parsed;
        return resolver.resolve(event.dateToken(), event.timeToken(), from, to);
    }

    /**
     * SHA-1 over the lower-cased identity fields. Stable across runs for the same logical fixture.
     */
    public static String externalId(String source, String competition, String home, String away, String datetime,
                                    String venue) {
        String base = String.join("|", nullToEmpty(source), nullToEmpty(competition), nullToEmpty(home),
            nullToEmpty(away), nullToEmpty(datetime), nullToEmpty(venue)).toLowerCase(Locale.ROOT);
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(sha1.digest(base.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
