package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.http.AuthorizationException;
import com.bhzfootball.agenda.http.FetchException;
import com.bhzfootball.agenda.http.RateLimitedFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Plain HTTP page loader with an optional {@link PageCache}.
 * <ul>
 *   <li>offline: only the cached copy is used, no request is made;</li>
 *   <li>cache enabled: a fresh page refreshes the cache, a failed fetch falls back to the cached copy;</li>
 *   <li>otherwise: straight fetch.</li>
 * </ul>
 * Authorization failures are never masked by the cache.
 */
public class HttpPageLoader implements PageLoaderInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpPageLoader.class);

    /** Headers of a desktop browser; some sites serve an empty shell to unknown agents. */
    public static final Map<String, String> BROWSER_HEADERS = Map.of(
        "User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/124.0 Safari/537.36",
        "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
        "Accept-Language", "pt-BR,pt;q=0.9,en-US;q=0.8,en;q=0.7"
    );

    private final RateLimitedFetcher fetcher;
    private final PageCache cache;
    private final boolean offline;

    /**
     * @param fetcher fetcher used for live requests
     * @param cache page cache, or null to disable caching
     * @param offline serve from the cache only
     */
    public HttpPageLoader(RateLimitedFetcher fetcher, PageCache cache, boolean offline) {
        if (offline && cache == null) throw new IllegalArgumentException("Offline mode needs a page cache");
        this.fetcher = fetcher;
        this.cache = cache;
        this.offline = offline;
    }

    @Override
    public String load(String url) {
        if (offline) {
            logger.info("Offline mode: reading {} from cache", url);
            return cache.read(url).orElseThrow(() -> new FetchException("No cached copy of " + url, url));
        }
        try {
            String html = fetcher.getText(url, Map.of());
            if (cache != null) cache.write(url, html);
            return html;
        } catch (AuthorizationException e) {
            throw e;
        } catch (FetchException e) {
            Optional<String> cached = cache == null ? Optional.empty() : cache.read(url);
            if (cached.isEmpty()) throw e;
            logger.warn("Fetching {} failed ({}). Using cached copy.", url, e.getMessage());
            return cached.get();
        }
    }
}
