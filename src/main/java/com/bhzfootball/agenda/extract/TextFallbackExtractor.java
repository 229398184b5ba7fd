package com.bhzfootball.agenda.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort over the flattened page text. Reads the list that follows a known marker such as
 * "Próximas partidas:" up to a terminator ("Ver mais") and splits it on commas, one candidate match per item.
 * Items need a day/month token and a two-way team split to survive.
 */
public class TextFallbackExtractor implements ExtractionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(TextFallbackExtractor.class);

    public static final List<String> DEFAULT_MARKERS = List.of("Upcoming matches:", "Próximas partidas:");
    public static final List<String> DEFAULT_TERMINATORS = List.of("Show more", "Mostrar mais", "See more", "Ver mais");

    private static final List<Pattern> SEPARATORS = List.of(literal(" v "), literal(" x "), literal(" - "));
    private static final Pattern DAY_MONTH = Pattern.compile("(?<!\\d)(\\d{1,2})[/.](\\d{1,2})(?!\\d)");
    private static final Pattern TIME = Pattern.compile("(?<!\\d)([01]?\\d|2[0-3]):([0-5]\\d)(?!\\d)");

    private final List<Pattern> markers;
    private final List<Pattern> terminators;

    public TextFallbackExtractor(List<String> markers, List<String> terminators) {
        this.markers = literals(markers);
        this.terminators = literals(terminators);
    }

    public static TextFallbackExtractor withDefaults() {
        return new TextFallbackExtractor(DEFAULT_MARKERS, DEFAULT_TERMINATORS);
    }

    @Override
    public ExtractionKind kind() {
        return ExtractionKind.TEXT;
    }

    @Override
    public List<RawEvent> extract(PageContent page) {
        return extractFromText(page.flatText());
    }

    List<RawEvent> extractFromText(String text) {
        String section = section(text);
        if (section == null) return List.of();
        List<RawEvent> events = new ArrayList<>();
        for (String item : section.split(",")) {
            RawEvent event = parseItem(item.trim());
            if (event != null) events.add(event);
        }
        logger.debug("Text fallback found {} events", events.size());
        return events;
    }

    /**
     * Text between the first marker found and the nearest terminator after it, or null without a marker.
     */
    String section(String text) {
        if (text == null) return null;
        // positions come from the original text; a lower-cased copy can differ in length
        for (Pattern marker : markers) {
            Matcher at = marker.matcher(text);
            if (!at.find()) continue;
            int start = at.end();
            int end = text.length();
            for (Pattern terminator : terminators) {
                Matcher stop = terminator.matcher(text);
                if (stop.find(start) && stop.start() < end) end = stop.start();
            }
            return text.substring(start, end);
        }
        return null;
    }

    private static RawEvent parseItem(String item) {
        if (item.isEmpty()) return null;
        Matcher date = DAY_MONTH.matcher(item);
        if (!date.find()) {
            logger.debug("Dropping '{}': no day/month token", item);
            return null;
        }
        String dateToken = date.group(1) + "/" + date.group(2);
        String timeToken = null;
        String rest = item.substring(0, date.start()) + " " + item.substring(date.end());
        Matcher time = TIME.matcher(rest);
        if (time.find()) {
            timeToken = time.group();
            rest = rest.substring(0, time.start()) + " " + rest.substring(time.end());
        }
        rest = " " + rest.replaceAll("\\s+", " ").trim() + " ";
        for (Pattern separator : SEPARATORS) {
            Matcher at = separator.matcher(rest);
            if (!at.find()) continue;
            String home = strip(rest.substring(0, at.start()));
            String away = strip(rest.substring(at.end()));
            if (home.isEmpty() || away.isEmpty()) continue;
            return RawEvent.builder(ExtractionKind.TEXT)
                .homeTeam(home)
                .awayTeam(away)
                .dateToken(dateToken)
                .timeToken(timeToken)
                .build();
        }
        logger.debug("Dropping '{}': no home/away split", item);
        return null;
    }

    private static Pattern literal(String value) {
        return Pattern.compile(Pattern.quote(value), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static List<Pattern> literals(List<String> values) {
        List<Pattern> patterns = new ArrayList<>();
        for (String value : values) patterns.add(literal(value));
        return List.copyOf(patterns);
    }

    private static String strip(String name) {
        return name.replaceAll("^[\\s\\-|:]+|[\\s\\-|:]+$", "");
    }
}
