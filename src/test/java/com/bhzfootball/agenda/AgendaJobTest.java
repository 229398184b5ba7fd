package com.bhzfootball.agenda;

import com.bhzfootball.agenda.extract.ExtractionKind;
import com.bhzfootball.agenda.extract.RawEvent;
import com.bhzfootball.agenda.http.AuthorizationException;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;

/**
 * Job flow: window, dry-run export, single post and abort on authorization failure.
 */
public class AgendaJobTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path outputDir;

    private final TeamCanonicalizer canonicalizer = new TeamCanonicalizer(TeamAliasTable.mineiroDefaults());
    private final List<List<NormalizedFixture>> posted = new ArrayList<>();
    private final IngestionServiceInterface recordingSink = fixtures -> {
        posted.add(fixtures);
        return new IngestionResult(true, 200, "{\"ok\": true}");
    };

    private AppConfig config(boolean dryRun) {
        Map<String, String> values = new HashMap<>();
        values.put("TEAMS", "Cruzeiro");
        values.put("DRY_RUN", dryRun ? "1" : "0");
        values.put("ODOO_URL", "https://odoo.example.test");
        values.put("ODOO_TOKEN", "secret");
        values.put("OUTPUT_DIR", outputDir.toString());
        return AppConfig.from(values::get);
    }

    private AgendaJob job(AppConfig config, IngestionServiceInterface sink, FakeSource... sources) {
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(List.of(sources),
            new FixtureNormalizer(canonicalizer, new DateTimeResolver(config.zone())), canonicalizer, new Deduplicator());
        return new AgendaJob(config, orchestrator, canonicalizer, sink, new CsvService(config.outputDir()), CLOCK);
    }

    private static RawEvent nextMatch() {
        return RawEvent.builder(ExtractionKind.HEURISTIC)
            .homeTeam("Cruzeiro").awayTeam("Tombense").dateToken("15/03").timeToken("16:00").build();
    }

    @Test
    void testPostsOnceWithAllFixtures() {
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", nextMatch());
        assertEquals(AgendaJob.Outcome.POSTED, job(config(false), recordingSink, ge).run());
        assertEquals(1, posted.size());
        assertEquals("2026-03-15 16:00:00", posted.get(0).get(0).matchDatetime());
    }

    @Test
    void testRejectedBatchIsReported() {
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", nextMatch());
        IngestionServiceInterface rejecting = fixtures -> new IngestionResult(false, 500, "boom");
        assertEquals(AgendaJob.Outcome.REJECTED, job(config(false), rejecting, ge).run());
    }

    @Test
    void testDryRunWritesCsvAndPostsNothing() throws Exception {
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", nextMatch());
        assertEquals(AgendaJob.Outcome.DRY_RUN, job(config(true), recordingSink, ge).run());
        assertTrue(posted.isEmpty());
        Path csv = outputDir.resolve("fixtures-2026-03-01.csv");
        assertTrue(Files.exists(csv));
        assertEquals(2, Files.readAllLines(csv).size());
    }

    @Test
    void testNothingFoundPostsNothing() {
        FakeSource ge = new FakeSource("ge.globo.com");
        assertEquals(AgendaJob.Outcome.NOTHING_TO_SEND, job(config(false), recordingSink, ge).run());
        assertTrue(posted.isEmpty());
    }

    @Test
    void testAuthorizationFailurePostsNothing() {
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", nextMatch());
        FakeSource locked = new FakeSource("sofascore")
            .failing("Cruzeiro", () -> new AuthorizationException("https://api.example.test/team/1241", 403));
        AgendaJob job = job(config(false), recordingSink, ge, locked);
        assertThrows(AuthorizationException.class, job::run);
        assertTrue(posted.isEmpty());
    }
}
