package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;

import java.util.List;

/**
 * Base of the HTML sources: pages come from a {@link PageLoaderInterface} and an empty page is dumped for diagnosis.
 */
public abstract class ScrapedPageSource implements FixtureSource {
    protected final PageLoaderInterface loader;
    private final ExtractionChain chain;
    private final PageDiagnostics diagnostics;

    protected ScrapedPageSource(PageLoaderInterface loader, ExtractionChain chain, PageDiagnostics diagnostics) {
        this.loader = loader;
        this.chain = chain;
        this.diagnostics = diagnostics;
    }

    @Override
    public ExtractionChain extractionChain() {
        return chain;
    }

    @Override
    public void onEmptyExtraction(TeamIdentity identity, PageContent page) {
        if (diagnostics != null) {
            diagnostics.dump(tag(), page, List.of(identity.team()));
        }
    }
}
