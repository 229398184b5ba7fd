package com.bhzfootball.agenda;

import com.bhzfootball.agenda.extract.ExtractionKind;
import com.bhzfootball.agenda.extract.RawEvent;
import com.bhzfootball.agenda.http.AuthorizationException;
import com.bhzfootball.agenda.http.RetriesExhaustedException;
import com.bhzfootball.agenda.sources.UnresolvableIdentityException;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.time.*;
import java.util.*;

/**
 * End-to-end orchestration over in-memory sources.
 */
public class PipelineOrchestratorTest {
    private static final LocalDate FROM = LocalDate.of(2026, 1, 1);
    private static final LocalDate TO = LocalDate.of(2026, 6, 30);
    private static final List<String> TEAMS = List.of("Cruzeiro", "Atlético-MG");

    private final TeamCanonicalizer canonicalizer = new TeamCanonicalizer(TeamAliasTable.mineiroDefaults());
    private final FixtureNormalizer normalizer =
        new FixtureNormalizer(canonicalizer, new DateTimeResolver(ZoneId.of("America/Sao_Paulo")));

    private PipelineOrchestrator orchestrator(FakeSource... sources) {
        return new PipelineOrchestrator(List.of(sources), normalizer, canonicalizer, new Deduplicator());
    }

    private static RawEvent classic(String round) {
        return RawEvent.builder(ExtractionKind.STRUCTURED)
            .homeTeam("Cruzeiro").awayTeam("Atlético Mineiro")
            .startDateTime("2026-03-15T16:00:00-03:00")
            .venue("Mineirão")
            .round(round)
            .build();
    }

    @Test
    void testSameFixtureFromTwoPassesCollapsesKeepingSecond() {
        FakeSource ge = new FakeSource("ge.globo.com")
            .events("Cruzeiro", classic("1ª rodada"))
            .events("Atletico-MG", classic("Rodada 1"));
        PipelineResult result = orchestrator(ge).run(TEAMS, FROM, TO);

        assertEquals(1, result.fixtures().size());
        NormalizedFixture fixture = result.fixtures().get(0);
        assertEquals("Rodada 1", fixture.round());
        assertEquals("Cruzeiro", fixture.homeTeam());
        assertEquals("Atletico-MG", fixture.awayTeam());
        assertEquals(FixtureNormalizer.externalId("ge.globo.com", "Campeonato Mineiro", "Cruzeiro", "Atletico-MG",
            "2026-03-15 16:00:00", "Mineirão"), fixture.externalId());
        assertEquals(Map.of("Cruzeiro", 1, "Atletico-MG", 1), result.collectedPerTeam());
        assertEquals(2, result.collectedTotal());
    }

    @Test
    void testWindowAndTeamFiltersApply() {
        RawEvent outside = RawEvent.builder(ExtractionKind.STRUCTURED)
            .homeTeam("Cruzeiro").awayTeam("Tombense").startDateTime("2026-09-01 16:00:00").build();
        RawEvent unrelated = RawEvent.builder(ExtractionKind.STRUCTURED)
            .homeTeam("Tombense").awayTeam("Villa Nova").startDateTime("2026-03-01 16:00:00").build();
        RawEvent kept = RawEvent.builder(ExtractionKind.STRUCTURED)
            .homeTeam("Raposa").awayTeam("Tombense").startDateTime("2026-03-01 16:00:00").build();
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", outside, unrelated, kept);

        PipelineResult result = orchestrator(ge).run(List.of("Cruzeiro"), FROM, TO);
        assertEquals(1, result.fixtures().size());
        assertEquals("Cruzeiro", result.fixtures().get(0).homeTeam());
        TeamRunReport report = result.reports().get(0);
        assertEquals(TeamState.DONE, report.state());
        assertEquals(3, report.extracted());
        assertEquals(1, report.kept());
    }

    @Test
    void testRecoverableFailuresDoNotStopOtherPasses() {
        FakeSource broken = new FakeSource("flashscore")
            .failing("Cruzeiro", () -> new RetriesExhaustedException("https://example.test", 3, new IOException("reset")))
            .failing("Atletico-MG", () -> new UnresolvableIdentityException("flashscore", "Atletico-MG"));
        FakeSource empty = new FakeSource("sofascore");
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", classic(null));

        PipelineResult result = orchestrator(broken, empty, ge).run(TEAMS, FROM, TO);

        assertEquals(1, result.fixtures().size());
        assertEquals(6, result.reports().size());
        TeamRunReport first = result.reports().get(0);
        assertEquals(TeamState.ERRORED, first.state());
        assertEquals(TeamState.FETCHING, first.failedAt());
        TeamRunReport emptyPass = result.reports().get(1);
        assertEquals(TeamState.ERRORED, emptyPass.state());
        assertEquals(TeamState.EXTRACTING, emptyPass.failedAt());
        assertEquals(List.of("Cruzeiro", "Atletico-MG"), empty.emptyPages);
        assertEquals(List.of("Cruzeiro", "Atletico-MG"), ge.fetched);
    }

    @Test
    void testAuthorizationFailureAbortsRun() {
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", classic(null));
        FakeSource locked = new FakeSource("api-football")
            .failing("Cruzeiro", () -> new AuthorizationException("https://example.test/fixtures", 403));

        assertThrows(AuthorizationException.class, () -> orchestrator(ge, locked).run(TEAMS, FROM, TO));
        assertEquals(List.of("Cruzeiro"), ge.fetched);
    }

    @Test
    void testTeamsAreProcessedInConfiguredOrder() {
        FakeSource ge = new FakeSource("ge.globo.com");
        orchestrator(ge).run(List.of("galo", "Cruzeiro", "coelho"), FROM, TO);
        assertEquals(List.of("Atletico-MG", "Cruzeiro", "America-MG"), ge.fetched);
    }

    @Test
    void testOutOfRangeEpochDropsOnlyThatEvent() {
        RawEvent broken = RawEvent.builder(ExtractionKind.API)
            .homeTeam("Cruzeiro").awayTeam("Tombense").epochSeconds(Long.MAX_VALUE).build();
        FakeSource sofascore = new FakeSource("sofascore").events("Cruzeiro", broken, classic("Rodada 1"));
        PipelineResult result = orchestrator(sofascore).run(List.of("Cruzeiro"), FROM, TO);

        assertEquals(1, result.fixtures().size());
        assertEquals("Cruzeiro", result.fixtures().get(0).homeTeam());
        TeamRunReport report = result.reports().get(0);
        assertEquals(TeamState.DONE, report.state());
        assertEquals(2, report.extracted());
        assertEquals(1, report.kept());
    }

    @Test
    void testUnexpectedFailureMarksOnlyThatPassErrored() {
        FakeSource faulty = new FakeSource("flashscore")
            .failing("Cruzeiro", () -> new IllegalStateException("layout changed"));
        FakeSource ge = new FakeSource("ge.globo.com").events("Cruzeiro", classic("Rodada 1"));
        PipelineResult result = orchestrator(faulty, ge).run(List.of("Cruzeiro"), FROM, TO);

        assertEquals(1, result.fixtures().size());
        TeamRunReport failed = result.reports().get(0);
        assertEquals(TeamState.ERRORED, failed.state());
        assertEquals(TeamState.FETCHING, failed.failedAt());
        assertTrue(failed.reason().contains("layout changed"));
        assertEquals(TeamState.DONE, result.reports().get(1).state());
    }
}
