package com.bhzfootball.agenda;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

public class CsvServiceTest {
    @TempDir
    Path outputDir;

    @Test
    void testWritesHeaderAndOneLinePerFixture() throws Exception {
        NormalizedFixture fixture = new NormalizedFixture("abc", "Campeonato Mineiro", "2026-03-15 16:00:00", "Cruzeiro",
            "Atletico-MG", "Mineirão\nPortão 3", "scheduled", "ge.globo.com", null, "5ª rodada", 2, 1);
        Path file = new CsvService(outputDir.resolve("out")).writeFixturesToCSV(List.of(fixture), "fixtures 2026-03-01.csv");

        assertEquals(outputDir.resolve("out").resolve("fixtures_2026-03-01.csv"), file);
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("\"external_id\",\"competition\",\"match_datetime\""));
        assertTrue(lines.get(1).contains("\"Mineirão Portão 3\""));
        assertTrue(lines.get(1).endsWith("\"2\",\"1\""));
    }

    @Test
    void testRejectsMissingArguments() {
        CsvService service = new CsvService(outputDir);
        assertThrows(IllegalArgumentException.class, () -> service.writeFixturesToCSV(null, "x.csv"));
        assertThrows(IllegalArgumentException.class, () -> service.writeFixturesToCSV(List.of(), " "));
    }
}
