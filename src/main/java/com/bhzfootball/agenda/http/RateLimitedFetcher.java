package com.bhzfootball.agenda.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Blocking HTTP GET wrapper with timeout, bounded retries and exponential backoff.
 * <p>
 * Status policy:
 * <ul>
 *   <li>connection failure, timeout or 429: retried up to {@code maxAttempts}, sleeping {@code backoff * 2^(attempt-1)}
 *       between attempts, then {@link RetriesExhaustedException};</li>
 *   <li>401/403: {@link AuthorizationException}, never retried;</li>
 *   <li>404: {@link NotFoundException};</li>
 *   <li>any other non-2xx: {@link HttpStatusException} with the body attached;</li>
 *   <li>2xx: the body, parsed as JSON by {@link #get(String, Map)} ({@link MalformedResponseException} otherwise).</li>
 * </ul>
 * Consecutive requests of one instance are spaced by {@code pause} to stay polite with upstream rate limits.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class RateLimitedFetcher {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitedFetcher.class);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final int maxAttempts;
    private final Duration backoff;
    private final Duration pause;
    private boolean firstRequest = true;

    public RateLimitedFetcher(HttpClient client, ObjectMapper mapper, String baseUrl, Map<String, String> headers,
                              Duration timeout, int maxAttempts, Duration backoff, Duration pause) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl == null ? "" : baseUrl.replaceAll("/+$", "");
        this.headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
        this.timeout = timeout;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.pause = pause;
    }

    /**
     * GETs a JSON resource.
     * @param path path relative to the base URL, or an absolute URL
     * @param params query parameters, blank values are skipped
     * @return parsed body
     */
    public JsonNode get(String path, Map<String, String> params) {
        String url = buildUrl(path, params);
        String body = execute(url);
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException(url, e);
        }
    }

    /**
     * GETs a text resource (HTML pages).
     */
    public String getText(String path, Map<String, String> params) {
        return execute(buildUrl(path, params));
    }

    /**
     * Sleep before the given retry attempt (1-based): base, 2x base, 4x base...
     */
    public Duration backoffFor(int attempt) {
        return backoff.multipliedBy(1L << Math.max(0, attempt - 1));
    }

    String buildUrl(String path, Map<String, String> params) {
        String target = path.startsWith("http://") || path.startsWith("https://")
            ? path
            : baseUrl + (path.startsWith("/") ? path : "/" + path);
        if (params == null || params.isEmpty()) return target;
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) continue;
            query.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        if (query.length() == 0) return target;
        return target + (target.contains("?") ? "&" : "?") + query;
    }

    private String execute(String url) {
        politePause(url);
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HttpResponse<String> response = client.send(buildRequest(url), HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                logger.debug("GET {} -> {} ({} bytes)", url, status, response.body() == null ? 0 : response.body().length());
                if (status >= 200 && status < 300) {
                    return response.body() == null ? "" : response.body();
                }
                if (status == 401 || status == 403) {
                    throw new AuthorizationException(url, status);
                }
                if (status == 404) {
                    throw new NotFoundException(url);
                }
                if (status != 429) {
                    throw new HttpStatusException(url, status, response.body());
                }
                lastFailure = new HttpStatusException(url, status, response.body());
                logger.warn("Rate limited by {} (attempt {}/{})", url, attempt, maxAttempts);
            } catch (IOException e) {
                lastFailure = e;
                logger.warn("GET {} failed (attempt {}/{}): {}", url, attempt, maxAttempts, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException("Interrupted while fetching " + url, url, e);
            }
            if (attempt < maxAttempts) {
                Duration wait = backoffFor(attempt);
                logger.info("Retrying {} in {} ms ({}/{})", url, wait.toMillis(), attempt, maxAttempts);
                sleep(wait, url);
            }
        }
        logger.error("Giving up on {} after {} attempts.", url, maxAttempts);
        throw new RetriesExhaustedException(url, maxAttempts, lastFailure);
    }

    private HttpRequest buildRequest(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url)).timeout(timeout).GET();
        headers.forEach(builder::header);
        return builder.build();
    }

    private void politePause(String url) {
        if (firstRequest) {
            firstRequest = false;
            return;
        }
        sleep(pause, url);
    }

    private static void sleep(Duration duration, String url) {
        if (duration.isZero() || duration.isNegative()) return;
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting to fetch " + url, url, e);
        }
    }
}
