package com.bhzfootball.agenda;

import com.bhzfootball.agenda.extract.ExtractionKind;

/**
 * Outcome of one (team, source) pass.
 * @param team canonical team
 * @param source source tag
 * @param state {@link TeamState#DONE} or {@link TeamState#ERRORED}
 * @param failedAt stage that failed, null when done
 * @param strategy strategy whose events were used, null when none
 * @param extracted raw events extracted
 * @param kept fixtures that survived normalization and filtering
 * @param reason failure description, null when done
 */
public record TeamRunReport(
    String team,
    String source,
    TeamState state,
    TeamState failedAt,
    ExtractionKind strategy,
    int extracted,
    int kept,
    String reason
) {
    public boolean errored() {
        return state == TeamState.ERRORED;
    }
}
