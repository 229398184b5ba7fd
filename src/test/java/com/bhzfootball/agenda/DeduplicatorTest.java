package com.bhzfootball.agenda;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

/**
 * Deduplication keeps first-seen order while the last record for an id wins on content.
 */
public class DeduplicatorTest {
    private final Deduplicator deduplicator = new Deduplicator();

    private static NormalizedFixture fixture(String id, String venue) {
        return new NormalizedFixture(id, "Campeonato Mineiro", "2026-03-15 16:00:00", "Cruzeiro", "Atletico-MG",
            venue, "scheduled", "ge.globo.com", null, null, null, null);
    }

    @Test
    void testLastWriteWinsFirstPositionKept() {
        List<NormalizedFixture> input = List.of(
            fixture("a", "first"), fixture("b", "only"), fixture("a", "second"), fixture("c", "only"));
        List<NormalizedFixture> result = deduplicator.dedupe(input);
        assertEquals(3, result.size());
        assertEquals(List.of("a", "b", "c"), result.stream().map(NormalizedFixture::externalId).toList());
        assertEquals("second", result.get(0).venue());
    }

    @Test
    void testIdempotent() {
        List<NormalizedFixture> once = deduplicator.dedupe(List.of(
            fixture("a", "1"), fixture("b", "1"), fixture("a", "2")));
        assertEquals(once, deduplicator.dedupe(once));
    }

    @Test
    void testEmptyInput() {
        assertTrue(deduplicator.dedupe(List.of()).isEmpty());
    }
}
