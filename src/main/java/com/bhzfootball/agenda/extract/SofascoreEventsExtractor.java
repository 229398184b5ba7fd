package com.bhzfootball.agenda.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a SofaScore {@code /team/{id}/events/...} body into raw events.
 * Events are read from {@code events}, or {@code matches} on older payloads.
 */
public class SofascoreEventsExtractor implements ExtractionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(SofascoreEventsExtractor.class);

    @Override
    public ExtractionKind kind() {
        return ExtractionKind.API;
    }

    @Override
    public List<RawEvent> extract(PageContent page) {
        JsonNode body = page.json();
        if (body == null) return List.of();
        JsonNode items = body.has("events") ? body.get("events") : body.path("matches");
        List<RawEvent> events = new ArrayList<>();
        for (JsonNode item : items) {
            String home = name(item.path("homeTeam"));
            String away = name(item.path("awayTeam"));
            if (home == null || away == null) {
                logger.debug("SofaScore event {} without both teams skipped", item.path("id").asText());
                continue;
            }
            JsonNode start = item.get("startTimestamp");
            events.add(RawEvent.builder(ExtractionKind.API)
                .homeTeam(home)
                .awayTeam(away)
                .epochSeconds(start != null && start.canConvertToLong() ? start.asLong() : null)
                .venue(firstText(item.path("venue").path("name"), item.path("venue").path("stadium").path("name")))
                .competition(firstText(item.path("tournament").path("name"),
                    item.path("tournament").path("uniqueTournament").path("name")))
                .status(firstText(item.path("status").path("description"), item.path("status").path("type")))
                .round(item.path("roundInfo").has("round") ? item.path("roundInfo").path("round").asText() : null)
                .season(firstText(item.path("season").path("year"), item.path("season").path("name")))
                .homeGoals(goals(item.path("homeScore").path("current")))
                .awayGoals(goals(item.path("awayScore").path("current")))
                .build());
        }
        return events;
    }

    private static String name(JsonNode team) {
        return firstText(team.path("name"), team.path("shortName"));
    }

    static String firstText(JsonNode... nodes) {
        for (JsonNode node : nodes) {
            if (node != null && node.isValueNode() && !node.isNull() && !node.asText().isBlank()) return node.asText().trim();
        }
        return null;
    }

    static Integer goals(JsonNode node) {
        return node != null && node.isInt() ? node.asInt() : null;
    }
}
