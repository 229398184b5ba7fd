package com.bhzfootball.agenda.extract;

/**
 * Intermediate record produced by an extraction strategy.
 * <p>
 * Every field except {@code kind} is optional. Which ones are filled depends on the source and
 * the strategy that produced the event:
 * <ul>
 *   <li>Structured payloads and APIs usually carry a full timestamp ({@code startDateTime} or {@code epochSeconds}).</li>
 *   <li>DOM heuristics and the text fallback usually carry partial {@code dateToken}/{@code timeToken} values with no year.</li>
 * </ul>
 * An event without both team names is invalid and is dropped during normalization.
 *
 * @param kind strategy that produced the event
 * @param homeTeam home team name as scraped
 * @param awayTeam away team name as scraped
 * @param startDateTime full timestamp string (ISO or similar), or null
 * @param epochSeconds kick-off as epoch seconds, or null
 * @param dateToken partial date such as "15/03", or null
 * @param timeToken time such as "16:00", or null
 * @param venue stadium text, or null
 * @param status status text, or null
 * @param competition competition text, or null
 * @param round round/stage text, or null
 * @param season season text, or null
 * @param homeGoals home score when known
 * @param awayGoals away score when known
 */
public record RawEvent(
    ExtractionKind kind,
    String homeTeam,
    String awayTeam,
    String startDateTime,
    Long epochSeconds,
    String dateToken,
    String timeToken,
    String venue,
    String status,
    String competition,
    String round,
    String season,
    Integer homeGoals,
    Integer awayGoals
) {

    public boolean hasBothTeams() {
        return homeTeam != null && !homeTeam.isBlank() && awayTeam != null && !awayTeam.isBlank();
    }

    public static Builder builder(ExtractionKind kind) {
        return new Builder(kind);
    }

    public Builder toBuilder() {
        return new Builder(kind)
            .homeTeam(homeTeam).awayTeam(awayTeam)
            .startDateTime(startDateTime).epochSeconds(epochSeconds)
            .dateToken(dateToken).timeToken(timeToken)
            .venue(venue).status(status).competition(competition)
            .round(round).season(season)
            .homeGoals(homeGoals).awayGoals(awayGoals);
    }

    public static final class Builder {
        private final ExtractionKind kind;
        private String homeTeam;
        private String awayTeam;
        private String startDateTime;
        private Long epochSeconds;
        private String dateToken;
        private String timeToken;
        private String venue;
        private String status;
        private String competition;
        private String round;
        private String season;
        private Integer homeGoals;
        private Integer awayGoals;

        private Builder(ExtractionKind kind) {
            this.kind = kind;
        }

        public Builder homeTeam(String v) { this.homeTeam = v; return this; }
        public Builder awayTeam(String v) { this.awayTeam = v; return this; }
        public Builder startDateTime(String v) { this.startDateTime = v; return this; }
        public Builder epochSeconds(Long v) { this.epochSeconds = v; return this; }
        public Builder dateToken(String v) { this.dateToken = v; return this; }
        public Builder timeToken(String v) { this.timeToken = v; return this; }
        public Builder venue(String v) { this.venue = v; return this; }
        public Builder status(String v) { this.status = v; return this; }
        public Builder competition(String v) { this.competition = v; return this; }
        public Builder round(String v) { this.round = v; return this; }
        public Builder season(String v) { this.season = v; return this; }
        public Builder homeGoals(Integer v) { this.homeGoals = v; return this; }
        public Builder awayGoals(Integer v) { this.awayGoals = v; return this; }

        public RawEvent build() {
            return new RawEvent(kind, homeTeam, awayTeam, startDateTime, epochSeconds, dateToken, timeToken,
                venue, status, competition, round, season, homeGoals, awayGoals);
        }
    }
}
