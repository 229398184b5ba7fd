package com.bhzfootball.agenda.sources;

/**
 * A target team as a source knows it.
 * @param team canonical team name
 * @param id source-specific handle: a numeric API id or a page URL
 */
public record TeamIdentity(String team, String id) {
}
