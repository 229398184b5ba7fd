package com.bhzfootball.agenda;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable record representing one fixture in the canonical schema shipped to Odoo.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Built by {@link FixtureNormalizer} from a raw extracted event.</li>
 *   <li>{@code homeTeam}/{@code awayTeam} hold canonical names whenever the alias table matched.</li>
 *   <li>{@code matchDatetime} is always {@code yyyy-MM-dd HH:mm:ss} in the configured local zone, without offset.</li>
 *   <li>{@code externalId} is a content hash, used by {@link Deduplicator} to collapse repeated events.</li>
 * </ul>
 * Optional fields ({@code season}, {@code round}, goals) are left out of the JSON when null.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedFixture(
    @JsonProperty("external_id") String externalId,
    @JsonProperty("competition") String competition,
    @JsonProperty("match_datetime") String matchDatetime,
    @JsonProperty("home_team") String homeTeam,
    @JsonProperty("away_team") String awayTeam,
    @JsonProperty("venue") String venue,
    @JsonProperty("status") String status,
    @JsonProperty("source") String source,
    @JsonProperty("season") String season,
    @JsonProperty("round") String round,
    @JsonProperty("home_goals") Integer homeGoals,
    @JsonProperty("away_goals") Integer awayGoals
) {

    /**
     * Returns a copy with a different datetime string. Used when the sink asks for a re-normalized date.
     */
    public NormalizedFixture withMatchDatetime(String value) {
        return new NormalizedFixture(externalId, competition, value, homeTeam, awayTeam, venue, status, source,
            season, round, homeGoals, awayGoals);
    }
}
