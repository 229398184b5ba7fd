package com.bhzfootball.agenda;

import com.bhzfootball.agenda.http.AuthorizationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Main entry point of the BHZ football agenda collector.
 * Collects upcoming fixtures of the configured teams and publishes them to the Odoo {@code bhz_football} module.
 * <p>
 * Exit codes: 0 success (including dry runs and empty results), 1 configuration or sink failure,
 * 2 authorization refused by a source.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_UNAUTHORIZED = 2;

    /**
     * Main application entry point.
     * @param args {@code --KEY=value} overrides of the configuration
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        AppConfig config;
        try {
            config = AppConfig.load(args);
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        }

        ObjectMapper mapper = new ObjectMapper();
        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(config.httpTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        TeamCanonicalizer canonicalizer = new TeamCanonicalizer(TeamAliasTable.mineiroDefaults());
        DateTimeResolver resolver = new DateTimeResolver(config.zone());

        try (FixtureSourceFactory factory = new FixtureSourceFactory(config, client, mapper, canonicalizer)) {
            PipelineOrchestrator orchestrator = new PipelineOrchestrator(factory.create(),
                new FixtureNormalizer(canonicalizer, resolver), canonicalizer, new Deduplicator());
            IngestionServiceInterface ingestion = config.dryRun() ? null
                : new IngestionService(client, mapper, config.odooUrl(), config.odooToken(), config.httpTimeout(), resolver);
            AgendaJob job = new AgendaJob(config, orchestrator, canonicalizer, ingestion,
                new CsvService(config.outputDir()), Clock.systemDefaultZone());

            AgendaJob.Outcome outcome = job.run();
            logger.info("Run finished: {}", outcome);
            return outcome == AgendaJob.Outcome.REJECTED ? EXIT_FAILURE : EXIT_OK;
        } catch (AuthorizationException e) {
            logger.error("Authorization refused by {}. Run aborted, nothing was sent.", e.getUrl());
            return EXIT_UNAUTHORIZED;
        } catch (IngestionException e) {
            logger.error("Failed to deliver fixtures: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
