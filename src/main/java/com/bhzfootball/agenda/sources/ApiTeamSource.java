package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.TeamCanonicalizer;
import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.http.NotFoundException;
import com.bhzfootball.agenda.http.RateLimitedFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Base of the JSON API sources, which address teams by numeric id.
 * <p>
 * Identity resolution:
 * <ul>
 *   <li>a configured id is verified against the API first;</li>
 *   <li>when it is missing, unknown (404) or comes back empty, the API's team search is used, keeping the first result
 *       that canonicalizes to the requested team;</li>
 *   <li>when the search finds nothing either, {@link UnresolvableIdentityException} is thrown.</li>
 * </ul>
 * Other fetch failures propagate unchanged.
 */
public abstract class ApiTeamSource implements FixtureSource {
    private static final Logger logger = LoggerFactory.getLogger(ApiTeamSource.class);

    protected final RateLimitedFetcher fetcher;
    protected final TeamCanonicalizer canonicalizer;
    private final Map<String, Long> configuredIds;
    private final ExtractionChain chain;

    protected ApiTeamSource(RateLimitedFetcher fetcher, TeamCanonicalizer canonicalizer, Map<String, Long> configuredIds,
                            ExtractionChain chain) {
        this.fetcher = fetcher;
        this.canonicalizer = canonicalizer;
        this.configuredIds = new LinkedHashMap<>(configuredIds);
        this.chain = chain;
    }

    @Override
    public ExtractionChain extractionChain() {
        return chain;
    }

    @Override
    public TeamIdentity resolve(String team) {
        Long configured = configuredIds.get(team);
        if (configured != null) {
            try {
                if (verify(configured)) {
                    return new TeamIdentity(team, String.valueOf(configured));
                }
                logger.warn("{} returned no team for configured id {} ({}). Searching by name.", tag(), configured, team);
            } catch (NotFoundException e) {
                logger.warn("{} does not know configured id {} ({}). Searching by name.", tag(), configured, team);
            }
        }
        try {
            Optional<Long> found = search(team);
            if (found.isPresent()) {
                logger.info("{} resolved {} to id {} by search", tag(), team, found.get());
                return new TeamIdentity(team, String.valueOf(found.get()));
            }
        } catch (NotFoundException e) {
            logger.warn("{} team search for {} returned 404", tag(), team);
        }
        throw new UnresolvableIdentityException(tag(), team);
    }

    /**
     * True when the API confirms the id.
     * @throws NotFoundException when the API does not know the id
     */
    protected abstract boolean verify(long id);

    /**
     * Searches the API by team name.
     */
    protected abstract Optional<Long> search(String team);

    protected boolean matchesTeam(String candidate, String team) {
        return candidate != null && canonicalizer.comparisonKey(candidate).equals(canonicalizer.comparisonKey(team));
    }
}
