package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.TeamCanonicalizer;
import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;
import com.bhzfootball.agenda.http.RateLimitedFetcher;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * API-Football through RapidAPI. Requests carry the {@code x-rapidapi-key}/{@code x-rapidapi-host} pair and an empty
 * {@code response} array counts as "not found".
 */
public class ApiFootballSource extends ApiTeamSource {

    public static final String TAG = "api-football";
    public static final String COMPETITION = "API-Football";
    public static final String DEFAULT_HOST = "api-football-v1.p.rapidapi.com";

    private final String season;
    private final ZoneId zone;

    /**
     * @param season season year sent with fixture queries, or null to use the window start year
     */
    public ApiFootballSource(RateLimitedFetcher fetcher, TeamCanonicalizer canonicalizer, Map<String, Long> teamIds,
                             String season, ZoneId zone, ExtractionChain chain) {
        super(fetcher, canonicalizer, teamIds, chain);
        this.season = season;
        this.zone = zone;
    }

    public static String baseUrl(String host) {
        return "https://" + host + "/v3";
    }

    public static Map<String, String> headers(String key, String host) {
        return Map.of("x-rapidapi-key", key, "x-rapidapi-host", host);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String fallbackCompetition() {
        return COMPETITION;
    }

    @Override
    protected boolean verify(long id) {
        JsonNode body = fetcher.get("/teams", Map.of("id", String.valueOf(id)));
        for (JsonNode item : body.path("response")) {
            if (item.path("team").path("id").asLong(-1) == id) return true;
        }
        return false;
    }

    @Override
    protected Optional<Long> search(String team) {
        JsonNode body = fetcher.get("/teams", Map.of("search", team));
        for (JsonNode item : body.path("response")) {
            JsonNode candidate = item.path("team");
            if (matchesTeam(candidate.path("name").asText(null), team) && candidate.has("id")) {
                return Optional.of(candidate.get("id").asLong());
            }
        }
        return Optional.empty();
    }

    @Override
    public PageContent fetch(TeamIdentity identity, LocalDate from, LocalDate to) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("team", identity.id());
        params.put("from", from.toString());
        params.put("to", to.toString());
        params.put("season", season == null || season.isBlank() ? String.valueOf(from.getYear()) : season);
        params.put("timezone", zone.getId());
        return PageContent.json("/fixtures?team=" + identity.id(), fetcher.get("/fixtures", params));
    }
}
