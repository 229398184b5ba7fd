package com.bhzfootball.agenda;

import java.util.List;

/**
 * Downstream sink for normalized fixtures.
 */
public interface IngestionServiceInterface {
    /**
     * Sends the whole batch in one request.
     * @param fixtures deduplicated fixtures
     * @return outcome of the (last) request
     * @throws IngestionException when the sink cannot be reached
     */
    IngestionResult postMatches(List<NormalizedFixture> fixtures);
}
