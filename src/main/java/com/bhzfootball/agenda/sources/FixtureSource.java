package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;

import java.time.LocalDate;

/**
 * One upstream provider of fixtures.
 * <p>
 * A pass over a source for one team runs {@link #resolve(String)}, then {@link #fetch(TeamIdentity, LocalDate, LocalDate)},
 * then the source's {@link #extractionChain()}. Failures surface as unchecked exceptions:
 * {@link UnresolvableIdentityException} from resolution and {@code FetchException} subclasses from the network.
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public interface FixtureSource {

    /**
     * Tag written to {@code source} on every fixture and hashed into the external id.
     */
    String tag();

    /**
     * Competition label used when an event carries none.
     */
    String fallbackCompetition();

    /**
     * Maps a canonical team name to the source's handle for it.
     * @throws UnresolvableIdentityException when the source does not know the team
     */
    TeamIdentity resolve(String team);

    /**
     * Fetches the content listing the team's fixtures within the window.
     */
    PageContent fetch(TeamIdentity identity, LocalDate from, LocalDate to);

    ExtractionChain extractionChain();

    /**
     * Hook invoked when no strategy found anything on fetched content.
     */
    default void onEmptyExtraction(TeamIdentity identity, PageContent page) {
    }
}
