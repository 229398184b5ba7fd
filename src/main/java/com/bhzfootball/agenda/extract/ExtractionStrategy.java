package com.bhzfootball.agenda.extract;

import java.util.List;

/**
 * One way of pulling raw events out of a fetched payload.
 * Success is a non-empty list; an empty list means "nothing found here, try the next strategy". Implementations
 * skip malformed fragments instead of throwing.
 */
public interface ExtractionStrategy {

    ExtractionKind kind();

    List<RawEvent> extract(PageContent page);
}
