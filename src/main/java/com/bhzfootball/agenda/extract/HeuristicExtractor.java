package com.bhzfootball.agenda.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DOM heuristics for pages without structured data.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Find sections: headings ({@code h2..h5}) mentioning a section keyword select their enclosing
 *       {@code section}/{@code div}. Without any, {@code section[class*=jogos]} or the whole body is used.</li>
 *   <li>Find cards: the outermost {@code article}/{@code li}/{@code div} whose text holds exactly one
 *       "name SEP name" occurrence, plus every Flashscore {@code .event__match} row.</li>
 *   <li>Per card, each field is read from the first source that yields something, see {@link CardSelectors}.</li>
 * </ul>
 * There is no scoring or voting between selectors. Cards without both team names are skipped.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class HeuristicExtractor implements ExtractionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(HeuristicExtractor.class);

    public static final List<String> DEFAULT_SECTION_KEYWORDS =
        List.of("jogos", "rodada", "games", "round", "partidas", "fixtures");
    public static final List<String> DEFAULT_STADIUM_MARKERS =
        List.of("mineirão", "arena", "independência", "estádio", "estadio", "soares", "itacolomi", "castelão");

    static final Pattern SEPARATOR = Pattern.compile("(?:x|×|vs\\.?|v)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    // an optional score may sit on either side of the separator: "Cruzeiro 2 x 1 Atlético"
    private static final Pattern PAIR = Pattern.compile(
        "\\p{L}[\\p{L}\\-.']*\\s+(?:\\d{1,2}\\s+)?(?:x|×|vs\\.?|v)\\s+(?:\\d{1,2}\\s+)?\\p{L}",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern PAIR_SPLIT = Pattern.compile(
        "\\s+(?:\\d{1,2}\\s+)?(?:x|×|vs\\.?|v)\\s+(?:\\d{1,2}\\s+)?", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    static final Pattern DATE = Pattern.compile("(?<!\\d)(\\d{1,2})[/.](\\d{1,2})(?:[/.](\\d{4}|\\d{2})(?!\\d))?");
    static final Pattern TIME = Pattern.compile("(?<!\\d)([01]?\\d|2[0-3])\\s*[:h]\\s*([0-5]\\d)(?!\\d)");
    private static final Pattern ROUND = Pattern.compile(
        "(\\d{1,2}\\s*[ªa]?\\s*rodada|rodada\\s+\\d{1,2}|round\\s+\\d{1,2})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final List<String> sectionKeywords;
    private final List<String> stadiumMarkers;
    private final List<Pattern> stadiumPatterns;

    public HeuristicExtractor(List<String> sectionKeywords, List<String> stadiumMarkers) {
        this.sectionKeywords = lowerAll(sectionKeywords);
        this.stadiumMarkers = lowerAll(stadiumMarkers);
        List<Pattern> patterns = new ArrayList<>();
        for (String marker : stadiumMarkers) {
            patterns.add(Pattern.compile(Pattern.quote(marker), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        }
        this.stadiumPatterns = List.copyOf(patterns);
    }

    public static HeuristicExtractor withDefaults() {
        return new HeuristicExtractor(DEFAULT_SECTION_KEYWORDS, DEFAULT_STADIUM_MARKERS);
    }

    @Override
    public ExtractionKind kind() {
        return ExtractionKind.HEURISTIC;
    }

    @Override
    public List<RawEvent> extract(PageContent page) {
        Document doc = page.document();
        Map<Element, String> sections = findSections(doc);
        List<RawEvent> events = new ArrayList<>();
        Set<Element> used = Collections.newSetFromMap(new IdentityHashMap<>());
        int skipped = 0;
        for (Map.Entry<Element, String> section : sections.entrySet()) {
            for (Element card : findCards(section.getKey(), used)) {
                RawEvent event = parseCard(card, section.getValue());
                if (event == null) {
                    skipped++;
                } else {
                    events.add(event);
                }
            }
        }
        logger.debug("Heuristic scan of {}: {} sections, {} cards kept, {} skipped",
            page.url(), sections.size(), events.size(), skipped);
        return events;
    }

    /**
     * Sections keyed to the heading text that selected them (null for fallback sections).
     */
    Map<Element, String> findSections(Document doc) {
        // jsoup elements compare by identity
        Map<Element, String> ordered = new LinkedHashMap<>();
        for (Element heading : doc.select("h2, h3, h4, h5")) {
            String text = heading.text().toLowerCase(Locale.ROOT);
            if (sectionKeywords.stream().noneMatch(text::contains)) continue;
            Element container = enclosingContainer(heading);
            if (container != null && !ordered.containsKey(container)) {
                ordered.put(container, heading.text());
            }
        }
        if (!ordered.isEmpty()) return ordered;
        for (Element section : doc.select("section[class*=jogos]")) {
            ordered.put(section, null);
        }
        if (ordered.isEmpty() && doc.body() != null) {
            ordered.put(doc.body(), null);
        }
        return ordered;
    }

    private static Element enclosingContainer(Element heading) {
        int headingLength = heading.text().length();
        for (Element parent : heading.parents()) {
            String tag = parent.normalName();
            if (!tag.equals("section") && !tag.equals("div")) continue;
            // a wrapper holding only the heading is not the section
            if (parent.text().length() > headingLength) return parent;
        }
        return null;
    }

    List<Element> findCards(Element section, Set<Element> used) {
        List<Element> cards = new ArrayList<>();
        for (Element row : section.select(CardSelectors.EVENT_ROW)) {
            if (used.add(row)) cards.add(row);
        }
        // select() walks in document order, so an ancestor is always seen before its descendants
        for (Element candidate : section.select("article, li, div")) {
            if (used.contains(candidate) || hasUsedAncestor(candidate, used)) continue;
            if (countPairs(candidate.text()) == 1) {
                used.add(candidate);
                cards.add(candidate);
            }
        }
        return cards;
    }

    private static boolean hasUsedAncestor(Element element, Set<Element> used) {
        for (Element parent : element.parents()) {
            if (used.contains(parent)) return true;
        }
        return false;
    }

    static int countPairs(String text) {
        Matcher m = PAIR.matcher(text);
        int count = 0;
        while (m.find()) count++;
        return count;
    }

    private RawEvent parseCard(Element card, String sectionHeading) {
        List<String> segments = segments(card);
        String[] teams = teams(card, segments);
        if (teams == null) {
            logger.debug("Card without both team names skipped: {}", abbreviate(card.text()));
            return null;
        }
        RawEvent.Builder builder = RawEvent.builder(ExtractionKind.HEURISTIC)
            .homeTeam(teams[0])
            .awayTeam(teams[1]);
        readWhen(card, builder);
        builder.venue(venue(card, segments));
        builder.competition(competition(card));
        builder.status(firstText(card, CardSelectors.STATUS));
        builder.round(round(card, sectionHeading));
        builder.homeGoals(score(card, CardSelectors.HOME_SCORE, "data-home-score"));
        builder.awayGoals(score(card, CardSelectors.AWAY_SCORE, "data-away-score"));
        return builder.build();
    }

    private String[] teams(Element card, List<String> segments) {
        String home = attributeOrText(card, CardSelectors.HOME_TEAM, "data-home-team");
        String away = attributeOrText(card, CardSelectors.AWAY_TEAM, "data-away-team");
        if (home != null && away != null) return new String[]{home, away};

        List<Element> participants = card.select(CardSelectors.PARTICIPANT);
        if (participants.size() >= 2) {
            String first = participants.get(0).text().trim();
            String second = participants.get(1).text().trim();
            if (!first.isEmpty() && !second.isEmpty()) return new String[]{first, second};
        }
        return teamsFromSegments(segments);
    }

    /**
     * Team names from the card's own text pieces: a standalone separator between two names,
     * or a single piece reading "name SEP name".
     */
    static String[] teamsFromSegments(List<String> segments) {
        for (int i = 1; i < segments.size() - 1; i++) {
            if (!SEPARATOR.matcher(segments.get(i)).matches()) continue;
            String home = nameAround(segments, i, -1);
            String away = nameAround(segments, i, 1);
            if (home != null && away != null) return new String[]{home, away};
        }
        for (String segment : segments) {
            String[] parts = PAIR_SPLIT.split(segment, 2);
            if (parts.length != 2) continue;
            String home = cleanName(parts[0]);
            String away = cleanName(parts[1]);
            if (isNameLike(home) && isNameLike(away)) return new String[]{home, away};
        }
        return null;
    }

    /**
     * Nearest name-like segment from the separator at {@code index} in {@code direction}, stepping over a score.
     */
    private static String nameAround(List<String> segments, int index, int direction) {
        int i = index + direction;
        if (i >= 0 && i < segments.size() && segments.get(i).matches("\\d{1,2}")) i += direction;
        if (i < 0 || i >= segments.size()) return null;
        String name = cleanName(segments.get(i));
        return isNameLike(name) ? name : null;
    }

    private static String cleanName(String raw) {
        String cleaned = TIME.matcher(DATE.matcher(raw).replaceAll(" ")).replaceAll(" ");
        return cleaned.replaceAll("\\s+", " ").replaceAll("^[\\s\\-|,]+|[\\s\\-|,]+$", "").trim();
    }

    private static boolean isNameLike(String value) {
        if (value == null || value.isEmpty() || value.length() > 40) return false;
        return value.codePoints().anyMatch(Character::isLetter) && value.chars().noneMatch(Character::isDigit);
    }

    private static void readWhen(Element card, RawEvent.Builder builder) {
        String date = firstAttribute(card, CardSelectors.DATE_ATTRIBUTES);
        if (date == null) {
            Element time = card.selectFirst("time[datetime]");
            if (time != null) date = time.attr("datetime").trim();
        }
        if (date != null && !date.isEmpty()) {
            if (date.length() > 10 && ISO_DATE.matcher(date).lookingAt()) {
                builder.startDateTime(date);
                return;
            }
            builder.dateToken(date);
        }
        String time = firstAttribute(card, CardSelectors.TIME_ATTRIBUTES);
        String text = card.text();
        if (date == null || date.isEmpty()) {
            String calendarDate = calendarDate(card);
            Matcher m = DATE.matcher(calendarDate != null ? calendarDate : text);
            if (m.find()) builder.dateToken(m.group());
        }
        if (time == null) {
            Matcher m = TIME.matcher(text);
            if (m.find()) time = m.group();
        }
        builder.timeToken(time);
    }

    private static String calendarDate(Element card) {
        for (Element parent : card.parents()) {
            if (parent.hasClass("calendar__row")) {
                Element date = parent.selectFirst(".calendar__date");
                return date == null ? null : date.text();
            }
        }
        return null;
    }

    private String venue(Element card, List<String> segments) {
        String explicit = attributeOrText(card, CardSelectors.VENUE, "data-venue");
        if (explicit != null) return explicit;
        for (String segment : segments) {
            String lower = segment.toLowerCase(Locale.ROOT);
            if (segment.chars().noneMatch(Character::isDigit) && stadiumMarkers.stream().anyMatch(lower::contains)) {
                return segment.trim();
            }
        }
        // match on the original text, lower-casing can change its length
        String text = card.text();
        for (Pattern marker : stadiumPatterns) {
            Matcher m = marker.matcher(text);
            if (m.find()) return m.group();
        }
        return null;
    }

    private static String competition(Element card) {
        String inside = firstText(card, CardSelectors.COMPETITION);
        if (inside != null) return inside;
        // Flashscore puts the league header in a sibling row above the matches
        for (Element sibling = card.previousElementSibling(); sibling != null; sibling = sibling.previousElementSibling()) {
            String header = firstText(sibling, CardSelectors.COMPETITION);
            if (header != null) return header;
        }
        return null;
    }

    private static String round(Element card, String sectionHeading) {
        if (sectionHeading != null) {
            String lower = sectionHeading.toLowerCase(Locale.ROOT);
            if (lower.contains("rodada") || lower.contains("round")) return sectionHeading.trim();
        }
        Matcher m = ROUND.matcher(card.text());
        return m.find() ? m.group(1).trim() : null;
    }

    private static Integer score(Element card, List<String> selectors, String attribute) {
        String raw = attributeOrText(card, selectors, attribute);
        if (raw == null || !raw.matches("\\d{1,2}")) return null;
        return Integer.valueOf(raw);
    }

    /**
     * The card's own text pieces, in document order.
     */
    static List<String> segments(Element card) {
        List<String> segments = new ArrayList<>();
        card.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                String text = ((TextNode) node).text().trim();
                if (!text.isEmpty()) segments.add(text);
            }
        });
        return segments;
    }

    private static String attributeOrText(Element card, List<String> selectors, String attribute) {
        Element withAttribute = card.selectFirst("[" + attribute + "]");
        if (withAttribute != null && !withAttribute.attr(attribute).isBlank()) {
            return withAttribute.attr(attribute).trim();
        }
        return firstText(card, selectors);
    }

    private static String firstText(Element root, List<String> selectors) {
        for (String selector : selectors) {
            Element found = root.selectFirst(selector);
            if (found != null && !found.text().isBlank()) return found.text().trim();
        }
        return null;
    }

    private static String firstAttribute(Element card, List<String> attributes) {
        for (String attribute : attributes) {
            Element found = card.selectFirst("[" + attribute + "]");
            if (found != null && !found.attr(attribute).isBlank()) return found.attr(attribute).trim();
        }
        return null;
    }

    private static List<String> lowerAll(List<String> values) {
        List<String> lowered = new ArrayList<>();
        for (String value : values) lowered.add(value.toLowerCase(Locale.ROOT));
        return List.copyOf(lowered);
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
