package com.bhzfootball.agenda.extract;

import java.util.List;

/**
 * Central registry of the CSS selectors tried, in order, on a fixture card.
 * The first selector yielding non-empty text wins. Add new layouts here and {@link HeuristicExtractor} picks them up.
 */
public final class CardSelectors {
    private CardSelectors() {}

    /** Flashscore rows, always treated as cards. */
    public static final String EVENT_ROW = ".event__match";

    public static final List<String> HOME_TEAM = List.of(
        ".event__participant--home .event__participant__name",
        ".event__participant--home",
        "[data-home-team]",
        ".equipes__nome--mandante",
        ".placar__equipes--mandante .equipes__nome",
        ".team-home",
        ".home-team",
        ".home .team-name"
    );

    public static final List<String> AWAY_TEAM = List.of(
        ".event__participant--away .event__participant__name",
        ".event__participant--away",
        "[data-away-team]",
        ".equipes__nome--visitante",
        ".placar__equipes--visitante .equipes__nome",
        ".team-away",
        ".away-team",
        ".away .team-name"
    );

    /** Positional fallback: first element is home, second is away. */
    public static final String PARTICIPANT = ".event__participant";

    public static final List<String> DATE_ATTRIBUTES = List.of("data-event-date", "data-date", "data-start-date");
    public static final List<String> TIME_ATTRIBUTES = List.of("data-event-time", "data-time");

    public static final List<String> VENUE = List.of(
        "[data-venue]",
        ".jogo__informacoes--local",
        ".event__venue",
        ".venue",
        ".stadium"
    );

    public static final List<String> COMPETITION = List.of(
        ".event__title--name",
        ".event__title--type",
        ".jogo__informacoes--campeonato",
        ".competition"
    );

    public static final List<String> STATUS = List.of(".event__stage", ".match-status", ".status");

    public static final List<String> HOME_SCORE = List.of(".event__score--home", ".placar-box__valor--mandante");
    public static final List<String> AWAY_SCORE = List.of(".event__score--away", ".placar-box__valor--visitante");
}
