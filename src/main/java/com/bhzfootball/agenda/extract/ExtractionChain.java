package com.bhzfootball.agenda.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered list of strategies evaluated in turn. The first non-empty result wins and later strategies are not invoked.
 */
public class ExtractionChain {
    private static final Logger logger = LoggerFactory.getLogger(ExtractionChain.class);

    /**
     * Events plus the strategy that produced them ({@code null} when every strategy came back empty).
     */
    public record Outcome(List<RawEvent> events, ExtractionKind winner) {
        public boolean isEmpty() {
            return events.isEmpty();
        }
    }

    private final List<ExtractionStrategy> strategies;

    public ExtractionChain(List<ExtractionStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("An extraction chain needs at least one strategy");
        }
        this.strategies = List.copyOf(strategies);
    }

    public Outcome extract(PageContent page) {
        for (ExtractionStrategy strategy : strategies) {
            List<RawEvent> events = strategy.extract(page);
            if (events != null && !events.isEmpty()) {
                logger.info("{} extraction found {} events on {}", strategy.kind(), events.size(), page.url());
                return new Outcome(List.copyOf(events), strategy.kind());
            }
            logger.debug("{} extraction found nothing on {}", strategy.kind(), page.url());
        }
        return new Outcome(List.of(), null);
    }

    public List<ExtractionStrategy> strategies() {
        return strategies;
    }
}
