package com.bhzfootball.agenda.extract;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

/**
 * Marker-delimited match lists in flattened page text.
 */
public class TextFallbackExtractorTest {
    private final TextFallbackExtractor extractor = TextFallbackExtractor.withDefaults();

    @Test
    void testListBetweenMarkerAndTerminator() {
        String text = "Cruzeiro Esporte Clube Upcoming matches: 15/03 Cruzeiro v Tombense 16:00, "
            + "22.03 America-MG x Cruzeiro, Atlético - Cruzeiro, 29/03 Pouso Alegre - Cruzeiro Show more 01/04 Footer x Links";
        List<RawEvent> events = extractor.extractFromText(text);
        assertEquals(3, events.size());

        assertEquals("Cruzeiro", events.get(0).homeTeam());
        assertEquals("Tombense", events.get(0).awayTeam());
        assertEquals("15/03", events.get(0).dateToken());
        assertEquals("16:00", events.get(0).timeToken());
        assertEquals(ExtractionKind.TEXT, events.get(0).kind());

        assertEquals("America-MG", events.get(1).homeTeam());
        assertEquals("22/03", events.get(1).dateToken());
        assertNull(events.get(1).timeToken());

        assertEquals("Pouso Alegre", events.get(2).homeTeam());
        assertEquals("Cruzeiro", events.get(2).awayTeam());
    }

    @Test
    void testPortugueseMarkerInPage() {
        String html = "<html><body><div>Próximas partidas: 05/04 Cruzeiro x Villa Nova 20:30</div>"
            + "<a href=\"#\">Ver mais</a></body></html>";
        List<RawEvent> events = extractor.extract(PageContent.html("https://example.test/cruzeiro", html));
        assertEquals(1, events.size());
        assertEquals("Villa Nova", events.get(0).awayTeam());
        assertEquals("20:30", events.get(0).timeToken());
    }

    @Test
    void testNoMarker() {
        assertTrue(extractor.extractFromText("Cruzeiro x Tombense 15/03").isEmpty());
        assertNull(extractor.section(null));
    }

    @Test
    void testSectionStopsAtNearestTerminator() {
        assertEquals(" a, b ", extractor.section("Upcoming matches: a, b See more c Show more d"));
    }

    @Test
    void testMarkerAfterDottedCapitalI() {
        String text = "İİİİİİ İstanbul news. Upcoming matches: 15/03 Cruzeiro v Tombense, 20/03 Atletico x Villa Nova";
        List<RawEvent> events = extractor.extractFromText(text);
        assertEquals(2, events.size());
        assertEquals("Cruzeiro", events.get(0).homeTeam());
        assertEquals("Tombense", events.get(0).awayTeam());
        assertEquals("Atletico", events.get(1).homeTeam());
        assertEquals("Villa Nova", events.get(1).awayTeam());
        assertEquals("20/03", events.get(1).dateToken());
    }

    @Test
    void testUpperCaseSeparator() {
        List<RawEvent> events = extractor.extractFromText("Próximas partidas: 15/03 Cruzeiro X Tombense Ver mais");
        assertEquals(1, events.size());
        assertEquals("Tombense", events.get(0).awayTeam());
    }
}
