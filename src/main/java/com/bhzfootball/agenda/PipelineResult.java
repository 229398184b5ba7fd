package com.bhzfootball.agenda;

import java.util.List;
import java.util.Map;

/**
 * Result of a full run.
 * @param fixtures deduplicated fixtures, in first-seen order
 * @param reports one report per (team, source) pass, in execution order
 * @param collectedPerTeam fixtures accumulated per team before deduplication
 */
public record PipelineResult(
    List<NormalizedFixture> fixtures,
    List<TeamRunReport> reports,
    Map<String, Integer> collectedPerTeam
) {
    public int collectedTotal() {
        return collectedPerTeam.values().stream().mapToInt(Integer::intValue).sum();
    }
}
