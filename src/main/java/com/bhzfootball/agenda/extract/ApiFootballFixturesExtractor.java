package com.bhzfootball.agenda.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.bhzfootball.agenda.extract.SofascoreEventsExtractor.firstText;
import static com.bhzfootball.agenda.extract.SofascoreEventsExtractor.goals;

/**
 * Projects an API-Football {@code /fixtures} body ({@code response[]}) into raw events.
 * The kick-off comes from {@code fixture.timestamp}, with {@code fixture.date} as a fallback.
 */
public class ApiFootballFixturesExtractor implements ExtractionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(ApiFootballFixturesExtractor.class);

    @Override
    public ExtractionKind kind() {
        return ExtractionKind.API;
    }

    @Override
    public List<RawEvent> extract(PageContent page) {
        JsonNode body = page.json();
        if (body == null) return List.of();
        List<RawEvent> events = new ArrayList<>();
        for (JsonNode item : body.path("response")) {
            JsonNode fixture = item.path("fixture");
            JsonNode league = item.path("league");
            String home = firstText(item.path("teams").path("home").path("name"));
            String away = firstText(item.path("teams").path("away").path("name"));
            if (home == null || away == null) {
                logger.debug("API-Football fixture {} without both teams skipped", fixture.path("id").asText());
                continue;
            }
            JsonNode timestamp = fixture.get("timestamp");
            events.add(RawEvent.builder(ExtractionKind.API)
                .homeTeam(home)
                .awayTeam(away)
                .epochSeconds(timestamp != null && timestamp.canConvertToLong() ? timestamp.asLong() : null)
                .startDateTime(firstText(fixture.path("date")))
                .venue(firstText(fixture.path("venue").path("name")))
                .status(firstText(fixture.path("status").path("long"), fixture.path("status").path("short")))
                .competition(firstText(league.path("name")))
                .round(firstText(league.path("round")))
                .season(firstText(league.path("season")))
                .homeGoals(goals(item.path("goals").path("home")))
                .awayGoals(goals(item.path("goals").path("away")))
                .build());
        }
        return events;
    }
}
