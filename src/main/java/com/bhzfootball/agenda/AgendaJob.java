package com.bhzfootball.agenda;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * One scheduled run: window, pipeline, summary, then either the dry-run export or a single post to Odoo.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class AgendaJob {
    private static final Logger logger = LoggerFactory.getLogger(AgendaJob.class);

    /** How a run ended. */
    public enum Outcome {
        NOTHING_TO_SEND,
        DRY_RUN,
        POSTED,
        REJECTED
    }

    private final AppConfig config;
    private final PipelineOrchestrator orchestrator;
    private final TeamCanonicalizer canonicalizer;
    private final IngestionServiceInterface ingestion;
    private final CsvServiceInterface csvService;
    private final Clock clock;

    /**
     * @param ingestion sink client, may be null for dry runs
     */
    public AgendaJob(AppConfig config, PipelineOrchestrator orchestrator, TeamCanonicalizer canonicalizer,
                     IngestionServiceInterface ingestion, CsvServiceInterface csvService, Clock clock) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.canonicalizer = canonicalizer;
        this.ingestion = ingestion;
        this.csvService = csvService;
        this.clock = clock;
    }

    /**
     * Runs the job.
     * @throws com.bhzfootball.agenda.http.AuthorizationException when a source refuses access; nothing is posted
     */
    public Outcome run() {
        LocalDate today = LocalDate.now(clock.withZone(config.zone()));
        LocalDate from = today.minusDays(config.daysBack());
        LocalDate to = today.plusDays(config.daysForward());
        logger.info("Window {} .. {} ({})", from, to, config.zone());

        PipelineResult result = orchestrator.run(config.teams(), from, to);
        logSummary(result);

        List<NormalizedFixture> fixtures = result.fixtures();
        if (fixtures.isEmpty()) {
            logger.warn("No fixtures found for {}. Nothing to send.", config.teams());
            return Outcome.NOTHING_TO_SEND;
        }
        if (config.dryRun()) {
            logTable(fixtures);
            try {
                csvService.writeFixturesToCSV(fixtures, "fixtures-" + today + ".csv");
            } catch (IOException e) {
                logger.error("Failed to write dry-run CSV: {}", e.getMessage());
            }
            logger.info("DRY_RUN enabled. {} fixtures not sent.", fixtures.size());
            return Outcome.DRY_RUN;
        }
        IngestionResult response = ingestion.postMatches(fixtures);
        return response.ok() ? Outcome.POSTED : Outcome.REJECTED;
    }

    private void logSummary(PipelineResult result) {
        for (var entry : result.collectedPerTeam().entrySet()) {
            Set<String> key = Set.of(canonicalizer.comparisonKey(entry.getKey()));
            long unique = result.fixtures().stream()
                .filter(f -> canonicalizer.isTarget(f.homeTeam(), key) || canonicalizer.isTarget(f.awayTeam(), key))
                .count();
            logger.info("  {}: {} collected, {} after deduplication", entry.getKey(), entry.getValue(), unique);
        }
        long errored = result.reports().stream().filter(TeamRunReport::errored).count();
        logger.info("Total: {} collected, {} unique, {}/{} passes errored",
            result.collectedTotal(), result.fixtures().size(), errored, result.reports().size());
    }

    private static void logTable(List<NormalizedFixture> fixtures) {
        for (NormalizedFixture f : fixtures) {
            logger.info("  {} | {} x {} ({}) - {}", f.matchDatetime(), f.homeTeam(), f.awayTeam(), f.competition(),
                f.venue() == null || f.venue().isEmpty() ? "?" : f.venue());
        }
    }
}
