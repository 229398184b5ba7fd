package com.bhzfootball.agenda;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;
import java.nio.file.Path;
import java.util.*;

/**
 * Exit codes of a full run without network access.
 */
public class MainTest {
    @TempDir
    Path outputDir;

    @Test
    void testInvalidConfigurationExitsWithFailure() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"--DRY_RUN=1", "--DAYS_FORWARD=soon"}));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"--DRY_RUN=1", "--SCRAPER_RENDER=curl"}));
    }

    @Test
    void testOfflineRunWithEmptyCacheFindsNothing() {
        int code = Main.run(new String[]{
            "--DRY_RUN=1",
            "--SOURCES=ge,flashscore",
            "--SCRAPER_OFFLINE=1",
            "--OUTPUT_DIR=" + outputDir
        });
        assertEquals(Main.EXIT_OK, code);
    }

    @Test
    void testSanitizeFilename() {
        assertEquals("Cruzeiro_x_Atletico_15_03_____", Utils.sanitizeFilename("Cruzeiro x Atletico 15/03?*<>|"));
    }
}
