package com.bhzfootball.agenda;

import com.bhzfootball.agenda.extract.ApiFootballFixturesExtractor;
import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.HeuristicExtractor;
import com.bhzfootball.agenda.extract.SofascoreEventsExtractor;
import com.bhzfootball.agenda.extract.StructuredExtractor;
import com.bhzfootball.agenda.extract.TextFallbackExtractor;
import com.bhzfootball.agenda.http.RateLimitedFetcher;
import com.bhzfootball.agenda.sources.ApiFootballSource;
import com.bhzfootball.agenda.sources.BrowserPageLoader;
import com.bhzfootball.agenda.sources.FixtureSource;
import com.bhzfootball.agenda.sources.FlashscoreSource;
import com.bhzfootball.agenda.sources.GeGloboSource;
import com.bhzfootball.agenda.sources.HttpPageLoader;
import com.bhzfootball.agenda.sources.PageCache;
import com.bhzfootball.agenda.sources.PageDiagnostics;
import com.bhzfootball.agenda.sources.PageLoaderInterface;
import com.bhzfootball.agenda.sources.SofascoreSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the configured sources, in configured order, each with its own fetcher so rate-limit pauses stay per host.
 * Closing the factory shuts down the headless browser when one was started.
 */
public class FixtureSourceFactory implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FixtureSourceFactory.class);

    private final AppConfig config;
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final TeamCanonicalizer canonicalizer;
    private BrowserPageLoader browserLoader;
    private PageLoaderInterface pageLoader;

    public FixtureSourceFactory(AppConfig config, HttpClient client, ObjectMapper mapper, TeamCanonicalizer canonicalizer) {
        this.config = config;
        this.client = client;
        this.mapper = mapper;
        this.canonicalizer = canonicalizer;
    }

    public List<FixtureSource> create() {
        List<FixtureSource> sources = new ArrayList<>();
        PageDiagnostics diagnostics = new PageDiagnostics(config.outputDir());
        for (String name : config.sources()) {
            switch (name) {
                case "ge":
                    sources.add(new GeGloboSource(pageLoader(), htmlChain(), diagnostics));
                    break;
                case "flashscore":
                    sources.add(new FlashscoreSource(pageLoader(), htmlChain(), diagnostics, FlashscoreSource.DEFAULT_TEAM_PAGES));
                    break;
                case "sofascore":
                    sources.add(new SofascoreSource(
                        fetcher(SofascoreSource.BASE_URL, SofascoreSource.HEADERS),
                        canonicalizer,
                        canonicalKeys(config.sofascoreTeamIds()),
                        new ExtractionChain(List.of(new SofascoreEventsExtractor()))));
                    break;
                case "apifootball":
                    if (config.apiFootballKey() == null) {
                        logger.info("API_FOOTBALL_KEY not set. Skipping API-Football.");
                        break;
                    }
                    sources.add(new ApiFootballSource(
                        fetcher(ApiFootballSource.baseUrl(config.apiFootballHost()),
                            ApiFootballSource.headers(config.apiFootballKey(), config.apiFootballHost())),
                        canonicalizer,
                        canonicalKeys(config.apiFootballTeamIds()),
                        config.apiFootballSeason(),
                        config.zone(),
                        new ExtractionChain(List.of(new ApiFootballFixturesExtractor()))));
                    break;
                default:
                    throw new ConfigurationException("Unknown source '" + name + "'");
            }
        }
        logger.info("Sources enabled: {}", sources.stream().map(FixtureSource::tag).toList());
        return sources;
    }

    private ExtractionChain htmlChain() {
        return new ExtractionChain(List.of(
            new StructuredExtractor(mapper),
            HeuristicExtractor.withDefaults(),
            TextFallbackExtractor.withDefaults()
        ));
    }

    private PageLoaderInterface pageLoader() {
        if (pageLoader == null) {
            if (config.render().equals("browser")) {
                browserLoader = new BrowserPageLoader(BrowserPageLoader.DEFAULT_READY_SELECTOR,
                    (int) config.httpTimeout().toMillis());
                pageLoader = browserLoader;
            } else {
                PageCache cache = config.usesPageCache() ? new PageCache(config.outputDir().resolve("cache")) : null;
                pageLoader = new HttpPageLoader(fetcher("", HttpPageLoader.BROWSER_HEADERS), cache, config.offline());
            }
        }
        return pageLoader;
    }

    private RateLimitedFetcher fetcher(String baseUrl, Map<String, String> headers) {
        return new RateLimitedFetcher(client, mapper, baseUrl, headers, config.httpTimeout(),
            config.fetchMaxAttempts(), config.fetchBackoff(), config.fetchPause());
    }

    private Map<String, Long> canonicalKeys(Map<String, Long> ids) {
        Map<String, Long> canonical = new LinkedHashMap<>();
        ids.forEach((team, id) -> canonical.put(canonicalizer.canonicalize(team), id));
        return canonical;
    }

    @Override
    public void close() {
        if (browserLoader != null) browserLoader.close();
    }
}
