package com.bhzfootball.agenda;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses fixtures sharing an {@code external_id}.
 * <p>
 * The last record seen for a key wins on content, while the key keeps the position of its first occurrence.
 * Downstream consumers rely on which instance's fields survive, so this must not become first-write-wins.
 */
public class Deduplicator {

    public List<NormalizedFixture> dedupe(List<NormalizedFixture> fixtures) {
        // LinkedHashMap.put on an existing key replaces the value without moving the entry
        Map<String, NormalizedFixture> byId = new LinkedHashMap<>();
        for (NormalizedFixture fixture : fixtures) {
            byId.put(fixture.externalId(), fixture);
        }
        return new ArrayList<>(byId.values());
    }
}
