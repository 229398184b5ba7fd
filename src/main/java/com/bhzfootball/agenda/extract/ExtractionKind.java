package com.bhzfootball.agenda.extract;

/**
 * Tags a {@link RawEvent} with the strategy that produced it.
 */
public enum ExtractionKind {
    STRUCTURED,
    HEURISTIC,
    TEXT,
    API
}
