package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.TeamCanonicalizer;
import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;
import com.bhzfootball.agenda.http.RateLimitedFetcher;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * SofaScore public API. The next events of a team come from {@code /team/{id}/events/next/0}.
 */
public class SofascoreSource extends ApiTeamSource {

    public static final String TAG = "sofascore";
    public static final String COMPETITION = "SofaScore";
    public static final String BASE_URL = "https://api.sofascore.com/api/v1";
    public static final Map<String, String> HEADERS = Map.of(
        "Origin", "https://www.sofascore.com",
        "Referer", "https://www.sofascore.com/",
        "Accept", "application/json"
    );
    public static final Map<String, Long> DEFAULT_TEAM_IDS = Map.of(
        "Cruzeiro", 1241L,
        "Atletico-MG", 1237L,
        "America-MG", 1234L
    );

    public SofascoreSource(RateLimitedFetcher fetcher, TeamCanonicalizer canonicalizer, Map<String, Long> teamIds,
                           ExtractionChain chain) {
        super(fetcher, canonicalizer, teamIds, chain);
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
        JsonNode body = fetcher.get("/team/" + id, Map.of());
        return body.path("team").path("id").asLong(-1) == id;
    }

    @Override
    protected Optional<Long> search(String team) {
        JsonNode body = fetcher.get("/search/teams", Map.of("q", team));
        for (JsonNode candidate : body.path("teams")) {
            if (matchesTeam(candidate.path("name").asText(null), team) && candidate.has("id")) {
                return Optional.of(candidate.get("id").asLong());
            }
        }
        // the combined search endpoint wraps teams in results[].entity
        for (JsonNode result : body.path("results")) {
            JsonNode entity = result.path("entity");
            if (matchesTeam(entity.path("name").asText(null), team) && entity.has("id")) {
                return Optional.of(entity.get("id").asLong());
            }
        }
        return Optional.empty();
    }

    @Override
    public PageContent fetch(TeamIdentity identity, LocalDate from, LocalDate to) {
        String path = "/team/" + identity.id() + "/events/next/0";
        return PageContent.json(BASE_URL + path, fetcher.get(path, Map.of()));
    }
}
