package com.bhzfootball.agenda;

/**
 * Stages of one (team, source) pass. {@link #ERRORED} is the recoverable failure branch.
 */
public enum TeamState {
    RESOLVING,
    FETCHING,
    EXTRACTING,
    NORMALIZING,
    FILTERING,
    DONE,
    ERRORED
}
