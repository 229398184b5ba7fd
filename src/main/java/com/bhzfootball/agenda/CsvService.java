package com.bhzfootball.agenda;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports fixtures to CSV using OpenCSV, one row per fixture with the same column names as the JSON sent to Odoo.
 * Used by dry runs to review what would be posted.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {
        "external_id", "competition", "match_datetime", "home_team", "away_team", "venue", "status", "source",
        "season", "round", "home_goals", "away_goals"
    };

    private final Path outputDir;

    public CsvService(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public Path writeFixturesToCSV(List<NormalizedFixture> fixtures, String filename) throws IOException {
        if (fixtures == null) {
            throw new IllegalArgumentException("Fixture list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(Utils.sanitizeFilename(filename));
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (NormalizedFixture fixture : fixtures) {
                writer.writeNext(new String[]{
                    safe(fixture.externalId()),
                    safe(fixture.competition()),
                    safe(fixture.matchDatetime()),
                    safe(fixture.homeTeam()),
                    safe(fixture.awayTeam()),
                    safe(fixture.venue()),
                    safe(fixture.status()),
                    safe(fixture.source()),
                    safe(fixture.season()),
                    safe(fixture.round()),
                    fixture.homeGoals() == null ? "" : fixture.homeGoals().toString(),
                    fixture.awayGoals() == null ? "" : fixture.awayGoals().toString()
                });
            }
        }
        logger.info("Wrote {} fixtures to CSV file: {}", fixtures.size(), target);
        return target;
    }

    /**
     * Collapses line breaks so every fixture stays on one line.
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
