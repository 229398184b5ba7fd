package com.bhzfootball.agenda;

import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;
import com.bhzfootball.agenda.extract.RawEvent;
import com.bhzfootball.agenda.http.AuthorizationException;
import com.bhzfootball.agenda.http.FetchException;
import com.bhzfootball.agenda.sources.FixtureSource;
import com.bhzfootball.agenda.sources.TeamIdentity;
import com.bhzfootball.agenda.sources.UnresolvableIdentityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives every (team, source) pass and assembles the final fixture set.
 * <p>
 * Workflow, per target team in configured order and per source in configured order:
 * <ul>
 *   <li>RESOLVING: the source maps the team to its own handle.</li>
 *   <li>FETCHING: the page or API response is loaded.</li>
 *   <li>EXTRACTING: the source's extraction chain runs; the first non-empty strategy wins.</li>
 *   <li>NORMALIZING: raw events become {@link NormalizedFixture}s; unusable events are dropped.</li>
 *   <li>FILTERING: fixtures outside the window or not involving a target team are dropped.</li>
 * </ul>
 * Authorization failures abort the whole run. Any other failure marks the pass ERRORED and the run moves on.
 * Deduplication runs once, after every pass finished; nothing is emitted before that.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class PipelineOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final List<FixtureSource> sources;
    private final FixtureNormalizer normalizer;
    private final TeamCanonicalizer canonicalizer;
    private final Deduplicator deduplicator;

    public PipelineOrchestrator(List<FixtureSource> sources, FixtureNormalizer normalizer, TeamCanonicalizer canonicalizer,
                                Deduplicator deduplicator) {
        this.sources = List.copyOf(sources);
        this.normalizer = normalizer;
        this.canonicalizer = canonicalizer;
        this.deduplicator = deduplicator;
    }

    /**
     * Runs the pipeline.
     * @param teams target teams, any spelling
     * @param from window start, inclusive
     * @param to window end, inclusive
     * @return deduplicated fixtures plus per-pass reports
     * @throws AuthorizationException when any fetch is refused with 401/403
     */
    public PipelineResult run(List<String> teams, LocalDate from, LocalDate to) {
        Set<String> targets = new LinkedHashSet<>();
        for (String team : teams) targets.add(canonicalizer.canonicalize(team));
        Set<String> targetKeys = canonicalizer.comparisonKeys(targets);
        logger.info("Collecting fixtures for {} between {} and {} from {} sources", targets, from, to, sources.size());

        List<NormalizedFixture> collected = new ArrayList<>();
        List<TeamRunReport> reports = new ArrayList<>();
        Map<String, Integer> perTeam = new LinkedHashMap<>();
        for (String team : targets) {
            int teamTotal = 0;
            for (FixtureSource source : sources) {
                List<NormalizedFixture> kept = new ArrayList<>();
                TeamRunReport report = runPass(team, source, from, to, targetKeys, kept);
                reports.add(report);
                collected.addAll(kept);
                teamTotal += kept.size();
            }
            perTeam.put(team, teamTotal);
            logger.info("{}: {} fixtures collected", team, teamTotal);
        }

        List<NormalizedFixture> unique = deduplicator.dedupe(collected);
        logger.info("{} fixtures collected, {} after deduplication", collected.size(), unique.size());
        return new PipelineResult(unique, reports, perTeam);
    }

    private TeamRunReport runPass(String team, FixtureSource source, LocalDate from, LocalDate to, Set<String> targetKeys,
                                  List<NormalizedFixture> out) {
        TeamState state = TeamState.RESOLVING;
        try {
            TeamIdentity identity = source.resolve(team);

            state = TeamState.FETCHING;
            PageContent page = source.fetch(identity, from, to);

            state = TeamState.EXTRACTING;
            ExtractionChain.Outcome outcome = source.extractionChain().extract(page);
            if (outcome.isEmpty()) {
                source.onEmptyExtraction(identity, page);
                return errored(team, source, state, "no events extracted from " + page.url());
            }

            state = TeamState.NORMALIZING;
            List<NormalizedFixture> normalized = new ArrayList<>();
            for (RawEvent event : outcome.events()) {
                Optional<NormalizedFixture> fixture = normalizer.normalize(event, source.tag(), source.fallbackCompetition(), from, to);
                fixture.ifPresent(normalized::add);
            }

            state = TeamState.FILTERING;
            for (NormalizedFixture fixture : normalized) {
                if (!inWindow(fixture, from, to)) {
                    logger.debug("Outside window: {} {} x {}", fixture.matchDatetime(), fixture.homeTeam(), fixture.awayTeam());
                    continue;
                }
                if (!canonicalizer.isTarget(fixture.homeTeam(), targetKeys) && !canonicalizer.isTarget(fixture.awayTeam(), targetKeys)) {
                    continue;
                }
                out.add(fixture);
            }
            logger.info("[{}] {}: {} events via {}, {} kept", source.tag(), team, outcome.events().size(), outcome.winner(), out.size());
            return new TeamRunReport(team, source.tag(), TeamState.DONE, null, outcome.winner(), outcome.events().size(), out.size(), null);
        } catch (AuthorizationException e) {
            logger.error("[{}] {}: authorization refused ({}). Aborting run.", source.tag(), team, e.getMessage());
            throw e;
        } catch (UnresolvableIdentityException | FetchException | UncheckedIOException e) {
            out.clear();
            return errored(team, source, state, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("[{}] {}: unexpected failure while {}", source.tag(), team, state, e);
            out.clear();
            return errored(team, source, state, e.toString());
        }
    }

    private TeamRunReport errored(String team, FixtureSource source, TeamState failedAt, String reason) {
        logger.warn("[{}] {}: failed while {} - {}", source.tag(), team, failedAt, reason);
        return new TeamRunReport(team, source.tag(), TeamState.ERRORED, failedAt, null, 0, 0, reason);
    }

    static boolean inWindow(NormalizedFixture fixture, LocalDate from, LocalDate to) {
        LocalDate date = LocalDate.parse(fixture.matchDatetime().substring(0, 10));
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
