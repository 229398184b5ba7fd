package com.bhzfootball.agenda;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.*;
import java.util.*;

/**
 * Posting to a local stand-in for the Odoo endpoint.
 */
public class IngestionServiceTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> bodies = new ArrayList<>();
    private final List<String> authHeaders = new ArrayList<>();
    private final Deque<Integer> statuses = new ArrayDeque<>();
    private final Deque<String> replies = new ArrayDeque<>();
    private HttpServer server;
    private IngestionService service;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(IngestionService.MATCHES_PATH, exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authHeaders.add(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] reply = (replies.isEmpty() ? "{\"ok\": true}" : replies.poll()).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(statuses.isEmpty() ? 200 : statuses.poll(), reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        service = new IngestionService(HttpClient.newHttpClient(), mapper, baseUrl, "secret", Duration.ofSeconds(5),
            new DateTimeResolver(ZoneId.of("America/Sao_Paulo")));
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.stop(0);
    }

    private static NormalizedFixture fixture(String datetime) {
        return new NormalizedFixture("abc123", "Campeonato Mineiro", datetime, "Cruzeiro", "Atletico-MG",
            "Mineirao", "scheduled", "ge.globo.com", null, null, null, null);
    }

    @Test
    void testPostsBearerTokenAndMatches() throws Exception {
        IngestionResult result = service.postMatches(List.of(fixture("2026-03-15 16:00:00")));
        assertTrue(result.ok());
        assertEquals(200, result.statusCode());
        assertEquals(List.of("Bearer secret"), authHeaders);

        JsonNode sent = mapper.readTree(bodies.get(0));
        JsonNode match = sent.get("matches").get(0);
        assertEquals("abc123", match.get("external_id").asText());
        assertEquals("2026-03-15 16:00:00", match.get("match_datetime").asText());
        assertEquals("2026-03-15 16:00:00", match.get("date").asText());
        assertFalse(match.has("season"));
    }

    @Test
    void testDatetimeComplaintTriggersOneResubmit() throws Exception {
        statuses.add(400);
        replies.add("{\"error\": \"time data '2026-03-15T16:00:00' does not match format\"}");
        IngestionResult result = service.postMatches(List.of(fixture("2026-03-15T16:00:00")));
        assertTrue(result.ok());
        assertEquals(2, bodies.size());
        JsonNode resent = mapper.readTree(bodies.get(1)).get("matches").get(0);
        assertEquals("2026-03-15 16:00:00", resent.get("match_datetime").asText());
    }

    @Test
    void testCapitalizedDatetimeComplaintAlsoResubmits() {
        statuses.add(422);
        replies.add("{\"detail\": \"Time Data '2026-03-15T16:00:00' does not match format '%Y-%m-%d %H:%M:%S'\"}");
        IngestionResult result = service.postMatches(List.of(fixture("2026-03-15T16:00:00")));
        assertTrue(result.ok());
        assertEquals(2, bodies.size());
    }

    @Test
    void testSecondRejectionIsNotRetried() {
        statuses.addAll(List.of(400, 400));
        replies.addAll(List.of("time data mismatch", "time data mismatch"));
        IngestionResult result = service.postMatches(List.of(fixture("2026-03-15T16:00:00")));
        assertFalse(result.ok());
        assertEquals(400, result.statusCode());
        assertEquals(2, bodies.size());
    }

    @Test
    void testOtherRejectionIsReturnedAsIs() {
        statuses.add(500);
        replies.add("internal error");
        IngestionResult result = service.postMatches(List.of(fixture("2026-03-15 16:00:00")));
        assertFalse(result.ok());
        assertEquals("internal error", result.raw());
        assertEquals(1, bodies.size());
    }

    @Test
    void testUnreachableSinkThrows() {
        server.stop(0);
        server = null;
        assertThrows(IngestionException.class, () -> service.postMatches(List.of(fixture("2026-03-15 16:00:00"))));
    }
}
