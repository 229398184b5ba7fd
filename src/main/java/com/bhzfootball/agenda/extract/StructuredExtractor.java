package com.bhzfootball.agenda.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Extracts events from machine-readable payloads embedded in a page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Every {@code <script>} is inspected: JSON-LD and bare JSON scripts are parsed whole, {@code __NEXT_DATA__}
 *       payloads and {@code x = {...};} assignments are cut out by brace matching.</li>
 *   <li>Each parsed tree is walked recursively through objects and arrays of any depth.</li>
 *   <li>Objects typed {@code SportsEvent} or {@code Event} are projected into {@link RawEvent}s.</li>
 * </ul>
 * Fragments that do not parse are skipped; the page never fails as a whole.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class StructuredExtractor implements ExtractionStrategy {
    private static final Logger logger = LoggerFactory.getLogger(StructuredExtractor.class);

    private static final Set<String> EVENT_TYPES = Set.of("SportsEvent", "Event");
    private static final String NEXT_DATA_MARKER = "__NEXT_DATA__";

    private final ObjectMapper mapper;

    public StructuredExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ExtractionKind kind() {
        return ExtractionKind.STRUCTURED;
    }

    @Override
    public List<RawEvent> extract(PageContent page) {
        List<RawEvent> events = new ArrayList<>();
        for (Element script : page.document().select("script")) {
            String text = script.data().trim();
            if (text.isEmpty()) continue;
            String payload = payloadOf(text);
            if (payload == null) continue;
            JsonNode tree;
            try {
                tree = mapper.readTree(payload);
            } catch (JsonProcessingException e) {
                logger.debug("Skipping unparsable script payload on {}: {}", page.url(), e.getOriginalMessage());
                continue;
            }
            List<JsonNode> found = new ArrayList<>();
            collectEvents(tree, found);
            for (JsonNode node : found) {
                RawEvent event = toRawEvent(node);
                if (event != null) events.add(event);
            }
        }
        return events;
    }

    /**
     * Cuts the JSON payload out of a script body, or returns null when the script holds none.
     */
    static String payloadOf(String script) {
        if (script.startsWith("{") || script.startsWith("[")) {
            return script;
        }
        int marker = script.indexOf(NEXT_DATA_MARKER);
        if (marker >= 0) {
            int start = script.indexOf('{', marker);
            return start < 0 ? null : balancedFragment(script, start);
        }
        int assign = script.indexOf('=');
        while (assign >= 0) {
            int start = assign + 1;
            while (start < script.length() && Character.isWhitespace(script.charAt(start))) start++;
            if (start < script.length() && script.charAt(start) == '{') {
                String fragment = balancedFragment(script, start);
                if (fragment != null) return fragment;
            }
            assign = script.indexOf('=', assign + 1);
        }
        return null;
    }

    /**
     * Returns the text from {@code start} (an opening brace) to its matching closing brace, ignoring braces in strings.
     */
    static String balancedFragment(String text, int start) {
        int depth = 0;
        boolean inString = false;
        char quote = 0;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (ch == '\\') {
                    i++;
                } else if (ch == quote) {
                    inString = false;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                inString = true;
                quote = ch;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) return text.substring(start, i + 1);
            }
        }
        return null;
    }

    private void collectEvents(JsonNode node, List<JsonNode> out) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode item : node) collectEvents(item, out);
            return;
        }
        if (!node.isObject()) return;
        if (isEventType(node.get("@type"))) {
            out.add(node);
        }
        node.fields().forEachRemaining(entry -> collectEvents(entry.getValue(), out));
    }

    private static boolean isEventType(JsonNode type) {
        if (type == null) return false;
        if (type.isTextual()) return EVENT_TYPES.contains(type.asText());
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && EVENT_TYPES.contains(t.asText())) return true;
            }
        }
        return false;
    }

    private RawEvent toRawEvent(JsonNode event) {
        String home = participant(event.get("homeTeam"));
        String away = participant(event.get("awayTeam"));
        JsonNode competitors = event.get("competitor");
        if ((home == null || away == null) && competitors != null && competitors.isArray() && competitors.size() >= 2) {
            home = home == null ? participant(competitors.get(0)) : home;
            away = away == null ? participant(competitors.get(1)) : away;
        }
        if ((home == null || away == null) && event.hasNonNull("name")) {
            String[] parts = event.get("name").asText().split("\\s+(?:x|×|vs\\.?|v)\\s+", 2);
            if (parts.length == 2) {
                home = home == null ? parts[0].trim() : home;
                away = away == null ? parts[1].trim() : away;
            }
        }
        if (home == null || away == null || home.isBlank() || away.isBlank()) {
            logger.debug("Structured event without both teams skipped: {}", event);
            return null;
        }
        return RawEvent.builder(ExtractionKind.STRUCTURED)
            .homeTeam(home)
            .awayTeam(away)
            .startDateTime(text(event, "startDate", "startTime", "start_date"))
            .venue(place(firstPresent(event, "location", "venue")))
            .status(status(firstPresent(event, "eventStatus", "status")))
            .competition(event.has("superEvent") ? text(event.get("superEvent"), "name") : null)
            .build();
    }

    private static String participant(JsonNode data) {
        if (data == null || data.isNull()) return null;
        if (data.isTextual()) return data.asText();
        if (data.isObject()) {
            return text(data, "name", "alternateName");
        }
        if (data.isArray()) {
            for (JsonNode item : data) {
                String name = participant(item);
                if (name != null) return name;
            }
        }
        return null;
    }

    private static String place(JsonNode location) {
        if (location == null || location.isNull()) return null;
        if (location.isTextual()) return location.asText();
        if (location.isObject()) {
            String name = text(location, "name");
            if (name != null) return name;
            JsonNode address = location.get("address");
            if (address != null && address.isTextual()) return address.asText();
        }
        return null;
    }

    private static String status(JsonNode status) {
        if (status == null || !status.isTextual()) return null;
        String value = status.asText();
        // schema.org statuses arrive as URLs, e.g. https://schema.org/EventScheduled
        int slash = value.lastIndexOf('/');
        return slash >= 0 ? value.substring(slash + 1) : value;
    }

    private static JsonNode firstPresent(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    private static String text(JsonNode node, String... keys) {
        if (node == null) return null;
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
