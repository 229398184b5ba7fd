package com.bhzfootball.agenda;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Client of the Odoo {@code bhz_football} ingestion endpoint.
 * <p>
 * Workflow:
 * <ul>
 *   <li>POSTs {@code {"matches": [...]}} to {@code {baseUrl}/bhz/football/api/matches} with a bearer token.</li>
 *   <li>Each match also carries {@code date}, a copy of {@code match_datetime} read by older module versions.</li>
 *   <li>When the sink rejects the batch with a Python {@code time data ...} parse error, every datetime is
 *       re-normalized and the batch is sent once more. There is no further retry.</li>
 * </ul>
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class IngestionService implements IngestionServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(IngestionService.class);

    public static final String MATCHES_PATH = "/bhz/football/api/matches";
    private static final String DATETIME_COMPLAINT = "time data";

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final DateTimeResolver resolver;

    public IngestionService(HttpClient client, ObjectMapper mapper, String baseUrl, String token, Duration timeout,
                            DateTimeResolver resolver) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.token = token;
        this.timeout = timeout;
        this.resolver = resolver;
    }

    @Override
    public IngestionResult postMatches(List<NormalizedFixture> fixtures) {
        IngestionResult first = send(fixtures);
        if (first.ok()) {
            logger.info("Odoo accepted {} matches (HTTP {})", fixtures.size(), first.statusCode());
            return first;
        }
        if (first.statusCode() >= 400 && first.raw() != null && first.raw().toLowerCase(Locale.ROOT).contains(DATETIME_COMPLAINT)) {
            logger.warn("Odoo rejected a datetime (HTTP {}). Re-normalizing and resubmitting once.", first.statusCode());
            IngestionResult second = send(renormalized(fixtures));
            if (second.ok()) {
                logger.info("Odoo accepted {} matches after re-normalization (HTTP {})", fixtures.size(), second.statusCode());
            } else {
                logger.error("Odoo rejected the resubmitted batch: HTTP {} {}", second.statusCode(), abbreviate(second.raw()));
            }
            return second;
        }
        logger.error("Odoo rejected the batch: HTTP {} {}", first.statusCode(), abbreviate(first.raw()));
        return first;
    }

    List<NormalizedFixture> renormalized(List<NormalizedFixture> fixtures) {
        List<NormalizedFixture> fixed = new ArrayList<>(fixtures.size());
        for (NormalizedFixture fixture : fixtures) {
            try {
                fixed.add(fixture.withMatchDatetime(resolver.renormalize(fixture.matchDatetime())));
            } catch (IllegalArgumentException e) {
                logger.warn("Keeping datetime of {} as is: {}", fixture.externalId(), e.getMessage());
                fixed.add(fixture);
            }
        }
        return fixed;
    }

    String body(List<NormalizedFixture> fixtures) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode matches = root.putArray("matches");
        for (NormalizedFixture fixture : fixtures) {
            ObjectNode item = mapper.valueToTree(fixture);
            item.put("date", fixture.matchDatetime());
            matches.add(item);
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IngestionException("Failed to serialize matches", e);
        }
    }

    private IngestionResult send(List<NormalizedFixture> fixtures) {
        String url = baseUrl + MATCHES_PATH;
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
            .timeout(timeout)
            .header("Authorization", "Bearer " + token)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body(fixtures)))
            .build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            return new IngestionResult(status >= 200 && status < 300, status, response.body());
        } catch (IOException e) {
            throw new IngestionException("Failed to reach " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionException("Interrupted while posting to " + url, e);
        }
    }

    private static String abbreviate(String raw) {
        if (raw == null) return "";
        return raw.length() > 300 ? raw.substring(0, 300) + "..." : raw;
    }
}
