package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.Utils;
import com.bhzfootball.agenda.extract.PageContent;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Debug artifacts for a page on which no strategy found fixtures: the raw HTML on disk, the most common CSS classes
 * and the text around the team names, so a changed layout can be diagnosed from one run.
 */
public class PageDiagnostics {
    private static final Logger logger = LoggerFactory.getLogger(PageDiagnostics.class);

    private static final int TOP_CLASSES = 20;
    private static final int CONTEXT_CHARS = 60;
    private static final int CONTEXTS_PER_KEYWORD = 3;

    private final Path outputDir;

    public PageDiagnostics(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * Writes {@code debug-<source>.html} and logs the class histogram and keyword contexts.
     * @return the written file, or null when it could not be written
     */
    public Path dump(String source, PageContent page, List<String> keywords) {
        Path file = outputDir.resolve("debug-" + Utils.sanitizeFilename(source) + ".html");
        Path written = null;
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, page.body(), StandardCharsets.UTF_8);
            written = file;
            logger.info("Saved debug HTML for {} to {}", source, file);
        } catch (IOException e) {
            logger.error("Failed to save debug HTML for {}: {}", source, e.getMessage());
        }
        logger.info("Most common classes on {}: {}", page.url(), topClasses(page));
        String text = page.flatText();
        for (String keyword : keywords) {
            for (String context : contexts(text, keyword)) {
                logger.info("Context for '{}': ...{}...", keyword, context);
            }
        }
        return written;
    }

    static String topClasses(PageContent page) {
        Map<String, Integer> counts = new HashMap<>();
        for (Element element : page.document().getAllElements()) {
            for (String name : element.classNames()) {
                counts.merge(name, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()).thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_CLASSES)
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }

    static List<String> contexts(String text, String keyword) {
        String lower = text.toLowerCase(Locale.ROOT);
        String needle = keyword.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        int at = lower.indexOf(needle);
        while (at >= 0 && found.size() < CONTEXTS_PER_KEYWORD) {
            int start = Math.max(0, at - CONTEXT_CHARS);
            int end = Math.min(text.length(), at + needle.length() + CONTEXT_CHARS);
            found.add(text.substring(start, end));
            at = lower.indexOf(needle, at + needle.length());
        }
        return found;
    }
}
