package com.bhzfootball.agenda;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable run configuration.
 * <p>
 * Every key is looked up in command-line {@code --KEY=value} flags first, then in Java system properties, then in the
 * environment. Defaults match a scheduled production run for the three Belo Horizonte clubs.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public record AppConfig(
    String odooUrl,
    String odooToken,
    List<String> teams,
    int daysBack,
    int daysForward,
    boolean dryRun,
    Duration httpTimeout,
    ZoneId zone,
    List<String> sources,
    int fetchMaxAttempts,
    Duration fetchBackoff,
    Duration fetchPause,
    String render,
    boolean cacheEnabled,
    boolean offline,
    Map<String, Long> sofascoreTeamIds,
    String apiFootballKey,
    String apiFootballHost,
    Map<String, Long> apiFootballTeamIds,
    String apiFootballSeason,
    Path outputDir
) {
    public static final String DEFAULT_TEAMS = "Cruzeiro,Atletico-MG,America-MG";
    public static final String DEFAULT_SOURCES = "ge,flashscore,sofascore,apifootball";
    public static final Set<String> KNOWN_SOURCES = Set.of("ge", "flashscore", "sofascore", "apifootball");
    public static final String DEFAULT_SOFASCORE_IDS = "Cruzeiro=1241,Atletico-MG=1237,America-MG=1234";

    /**
     * Loads the configuration of this process.
     * @param args command-line arguments ({@code --KEY=value})
     * @throws ConfigurationException when a value is missing or malformed
     */
    public static AppConfig load(String[] args) {
        Map<String, String> flags = Utils.parseArgs(args);
        return from(key -> flags.containsKey(key) ? flags.get(key) : Utils.propOrEnv(key, null));
    }

    /**
     * Builds the configuration from an arbitrary key lookup (null means unset).
     */
    public static AppConfig from(Function<String, String> lookup) {
        boolean dryRun = flag(lookup, "DRY_RUN");
        String odooUrl = trimToNull(lookup.apply("ODOO_URL"));
        String odooToken = trimToNull(lookup.apply("ODOO_TOKEN"));
        if (!dryRun && (odooUrl == null || odooToken == null)) {
            throw new ConfigurationException("ODOO_URL and ODOO_TOKEN are required unless DRY_RUN=1");
        }
        List<String> teams = csv(value(lookup, "TEAMS", DEFAULT_TEAMS));
        if (teams.isEmpty()) throw new ConfigurationException("TEAMS must name at least one team");

        List<String> sources = new ArrayList<>();
        for (String source : csv(value(lookup, "SOURCES", DEFAULT_SOURCES))) {
            String key = source.toLowerCase(Locale.ROOT);
            if (!KNOWN_SOURCES.contains(key)) {
                throw new ConfigurationException("Unknown source '" + source + "'. Known: " + KNOWN_SOURCES);
            }
            sources.add(key);
        }

        String render = value(lookup, "SCRAPER_RENDER", "http").toLowerCase(Locale.ROOT);
        if (!render.equals("http") && !render.equals("browser")) {
            throw new ConfigurationException("SCRAPER_RENDER must be 'http' or 'browser', got '" + render + "'");
        }
        int maxAttempts = integer(lookup, "FETCH_MAX_ATTEMPTS", 3);
        if (maxAttempts < 1) throw new ConfigurationException("FETCH_MAX_ATTEMPTS must be at least 1");

        ZoneId zone;
        try {
            zone = ZoneId.of(value(lookup, "TIMEZONE", "America/Sao_Paulo"));
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid TIMEZONE: " + e.getMessage(), e);
        }

        return new AppConfig(
            odooUrl == null ? null : odooUrl.replaceAll("/+$", ""),
            odooToken,
            teams,
            integer(lookup, "DAYS_BACK", 7),
            integer(lookup, "DAYS_FORWARD", 180),
            dryRun,
            Duration.ofSeconds(integer(lookup, "HTTP_TIMEOUT", 45)),
            zone,
            List.copyOf(sources),
            maxAttempts,
            Duration.ofMillis(integer(lookup, "FETCH_BACKOFF_MS", 1000)),
            Duration.ofMillis(integer(lookup, "FETCH_PAUSE_MS", 1500)),
            render,
            flag(lookup, "SCRAPER_CACHE"),
            flag(lookup, "SCRAPER_OFFLINE"),
            idMap(lookup, "SOFASCORE_TEAM_IDS", DEFAULT_SOFASCORE_IDS),
            trimToNull(lookup.apply("API_FOOTBALL_KEY")),
            value(lookup, "API_FOOTBALL_HOST", "api-football-v1.p.rapidapi.com"),
            idMap(lookup, "API_FOOTBALL_TEAM_IDS", ""),
            trimToNull(lookup.apply("API_FOOTBALL_SEASON")),
            Path.of(value(lookup, "OUTPUT_DIR", "scraped-data"))
        );
    }

    /**
     * The page cache is read in offline mode as well.
     */
    public boolean usesPageCache() {
        return cacheEnabled || offline;
    }

    private static String value(Function<String, String> lookup, String key, String defaultVal) {
        String raw = trimToNull(lookup.apply(key));
        return raw == null ? defaultVal : raw;
    }

    private static boolean flag(Function<String, String> lookup, String key) {
        String raw = value(lookup, key, "0").toLowerCase(Locale.ROOT);
        return raw.equals("1") || raw.equals("true") || raw.equals("yes");
    }

    private static int integer(Function<String, String> lookup, String key, int defaultVal) {
        String raw = trimToNull(lookup.apply(key));
        if (raw == null) return defaultVal;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    /**
     * Parses {@code Name=123,Other=456}.
     */
    static Map<String, Long> idMap(Function<String, String> lookup, String key, String defaultVal) {
        Map<String, Long> ids = new LinkedHashMap<>();
        for (String pair : csv(value(lookup, key, defaultVal))) {
            int eq = pair.lastIndexOf('=');
            if (eq <= 0) throw new ConfigurationException(key + " entries must look like Team=123, got '" + pair + "'");
            try {
                ids.put(pair.substring(0, eq).trim(), Long.parseLong(pair.substring(eq + 1).trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " has a non-numeric id in '" + pair + "'", e);
            }
        }
        return Map.copyOf(ids);
    }

    private static List<String> csv(String raw) {
        List<String> values = new ArrayList<>();
        if (raw == null) return values;
        for (String part : raw.split(",")) {
            if (!part.isBlank()) values.add(part.trim());
        }
        return List.copyOf(values);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
