package com.bhzfootball.agenda.sources;

/**
 * The team cannot be mapped to a handle of the source. The team is skipped for that source only.
 */
public class UnresolvableIdentityException extends RuntimeException {
    private final String source;
    private final String team;

    public UnresolvableIdentityException(String source, String team) {
        super(String.format("%s has no identity for team '%s'", source, team));
        this.source = source;
        this.team = team;
    }

    public String getSource() {
        return source;
    }

    public String getTeam() {
        return team;
    }
}
