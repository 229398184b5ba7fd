package com.bhzfootball.agenda.extract;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

/**
 * Card detection and field reading on ge-like and Flashscore-like markup.
 */
public class HeuristicExtractorTest {
    private final HeuristicExtractor extractor = HeuristicExtractor.withDefaults();

    private static final String GE_PAGE = "<html><body>"
        + "<header><h1>Futebol mineiro</h1></header>"
        + "<div class=\"agenda\">"
        + "<h2>Próximos jogos - 5ª rodada</h2>"
        + "<ul>"
        + "<li class=\"jogo\" data-date=\"15/03\" data-time=\"16:00\">"
        + "<span class=\"equipes__nome--mandante\">Cruzeiro</span><span>x</span>"
        + "<span class=\"equipes__nome--visitante\">Atlético-MG</span>"
        + "<span class=\"jogo__informacoes--local\">Mineirão</span>"
        + "<span class=\"jogo__informacoes--campeonato\">Campeonato Mineiro</span>"
        + "</li>"
        + "<li class=\"jogo\">"
        + "<span>22/03 18:30</span><span>América-MG</span><span>x</span><span>Cruzeiro</span>"
        + "<span>Arena Independência</span>"
        + "</li>"
        + "<li class=\"jogo\"><span>Sem adversário definido</span></li>"
        + "</ul>"
        + "</div>"
        + "</body></html>";

    private static final String FLASHSCORE_PAGE = "<html><body><div class=\"sportName soccer\">"
        + "<div class=\"event__header\"><div class=\"event__title--type\">BRAZIL</div>"
        + "<div class=\"event__title--name\">Mineiro</div></div>"
        + "<div class=\"event__match\" id=\"g_1_abc\">"
        + "<div class=\"event__time\">15.03. 16:00</div>"
        + "<div class=\"event__participant event__participant--home\">Cruzeiro</div>"
        + "<div class=\"event__participant event__participant--away\">Tombense</div>"
        + "</div>"
        + "<div class=\"event__match\" id=\"g_1_def\">"
        + "<div class=\"event__time\">21.03. 20:00</div>"
        + "<div class=\"event__participant event__participant--home\">Pouso Alegre</div>"
        + "<div class=\"event__participant event__participant--away\">Cruzeiro</div>"
        + "<div class=\"event__score--home\">1</div><div class=\"event__score--away\">2</div>"
        + "</div>"
        + "</div></body></html>";

    @Test
    void testGeStyleCards() {
        List<RawEvent> events = extractor.extract(PageContent.html("https://ge.globo.com/mg/futebol/", GE_PAGE));
        assertEquals(2, events.size());

        RawEvent first = events.get(0);
        assertEquals(ExtractionKind.HEURISTIC, first.kind());
        assertEquals("Cruzeiro", first.homeTeam());
        assertEquals("Atlético-MG", first.awayTeam());
        assertEquals("15/03", first.dateToken());
        assertEquals("16:00", first.timeToken());
        assertEquals("Mineirão", first.venue());
        assertEquals("Campeonato Mineiro", first.competition());
        assertEquals("Próximos jogos - 5ª rodada", first.round());

        RawEvent second = events.get(1);
        assertEquals("América-MG", second.homeTeam());
        assertEquals("Cruzeiro", second.awayTeam());
        assertEquals("22/03", second.dateToken());
        assertEquals("18:30", second.timeToken());
        assertEquals("Arena Independência", second.venue());
    }

    @Test
    void testFlashscoreRows() {
        List<RawEvent> events = extractor.extract(PageContent.html("https://www.flashscore.com/team/cruzeiro/", FLASHSCORE_PAGE));
        assertEquals(2, events.size());
        assertEquals("Cruzeiro", events.get(0).homeTeam());
        assertEquals("Tombense", events.get(0).awayTeam());
        assertEquals("15.03", events.get(0).dateToken());
        assertEquals("16:00", events.get(0).timeToken());
        assertEquals("Mineiro", events.get(0).competition());
        assertEquals("Pouso Alegre", events.get(1).homeTeam());
        assertEquals(1, events.get(1).homeGoals());
        assertEquals(2, events.get(1).awayGoals());
    }

    @Test
    void testPageWithoutMatches() {
        String html = "<html><body><h2>Notícias</h2><p>Cruzeiro anuncia reforço para a temporada.</p></body></html>";
        assertTrue(extractor.extract(PageContent.html("https://ge.globo.com/", html)).isEmpty());
    }

    @Test
    void testCountPairs() {
        assertEquals(1, HeuristicExtractor.countPairs("Cruzeiro x Atlético-MG Mineirão"));
        assertEquals(1, HeuristicExtractor.countPairs("Cruzeiro 2 x 1 Atlético"));
        assertEquals(2, HeuristicExtractor.countPairs("Cruzeiro x Atlético, América vs Tombense"));
        assertEquals(0, HeuristicExtractor.countPairs("Ingressos à venda"));
    }

    @Test
    void testTeamsFromSegments() {
        assertArrayEquals(new String[]{"Cruzeiro", "Atlético"},
            HeuristicExtractor.teamsFromSegments(List.of("Cruzeiro", "2", "x", "1", "Atlético")));
        assertArrayEquals(new String[]{"Villa Nova", "Cruzeiro"},
            HeuristicExtractor.teamsFromSegments(List.of("Sáb 15/03 16:00", "Villa Nova x Cruzeiro")));
        assertNull(HeuristicExtractor.teamsFromSegments(List.of("Cruzeiro", "Mineirão")));
    }

    @Test
    void testSegmentsFollowDocumentOrder() {
        var card = Jsoup.parse("<li><b>Cruzeiro</b> x <i>Tombense</i></li>").selectFirst("li");
        assertEquals(List.of("Cruzeiro", "x", "Tombense"), HeuristicExtractor.segments(card));
    }

    @Test
    void testVenueFoundAfterDottedCapitalI() {
        String html = "<html><body><ul><li class=\"jogo\">"
            + "<span>Cruzeiro</span><span>x</span><span>İnter</span><span>15/03 16:00 İİ Arena</span>"
            + "</li></ul></body></html>";
        List<RawEvent> events = extractor.extract(PageContent.html("https://ge.globo.com/", html));
        assertEquals(1, events.size());
        assertEquals("Cruzeiro", events.get(0).homeTeam());
        assertEquals("İnter", events.get(0).awayTeam());
        assertEquals("Arena", events.get(0).venue());
    }

    @Test
    void testWeekdayDateAttributeIsNotTimestamp() {
        String html = "<html><body><ul><li class=\"jogo\" data-date=\"Ter 15/03\" data-time=\"16:00\">"
            + "<span>Cruzeiro</span><span>x</span><span>Tombense</span>"
            + "</li></ul></body></html>";
        RawEvent event = extractor.extract(PageContent.html("https://ge.globo.com/", html)).get(0);
        assertNull(event.startDateTime());
        assertEquals("Ter 15/03", event.dateToken());
        assertEquals("16:00", event.timeToken());
    }

    @Test
    void testIsoDateAttributeIsTimestamp() {
        String html = "<html><body><ul><li class=\"jogo\" data-date=\"2026-03-15T16:00:00-03:00\">"
            + "<span>Cruzeiro</span><span>x</span><span>Tombense</span>"
            + "</li></ul></body></html>";
        RawEvent event = extractor.extract(PageContent.html("https://ge.globo.com/", html)).get(0);
        assertEquals("2026-03-15T16:00:00-03:00", event.startDateTime());
        assertNull(event.dateToken());
    }
}
