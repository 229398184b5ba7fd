package com.bhzfootball.agenda;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of normalized fixtures.
 */
public interface CsvServiceInterface {
    /**
     * Writes fixtures to a CSV file with a header row.
     * @param fixtures fixtures to export
     * @param filename name of the output file, resolved against the output directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writeFixturesToCSV(List<NormalizedFixture> fixtures, String filename) throws IOException;
}
