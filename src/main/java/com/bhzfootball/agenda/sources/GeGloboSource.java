package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * ge.globo Campeonato Mineiro page. One page lists every club of the state championship, so all teams resolve to it
 * and it is loaded once per run.
 */
public class GeGloboSource extends ScrapedPageSource {
    private static final Logger logger = LoggerFactory.getLogger(GeGloboSource.class);

    public static final String TAG = "ge.globo.com";
    public static final String PAGE_URL = "https://ge.globo.com/mg/futebol/campeonato-mineiro/";
    public static final String COMPETITION = "Campeonato Mineiro";

    private final String pageUrl;
    private PageContent page;

    public GeGloboSource(PageLoaderInterface loader, ExtractionChain chain, PageDiagnostics diagnostics, String pageUrl) {
        super(loader, chain, diagnostics);
        this.pageUrl = pageUrl;
    }

    public GeGloboSource(PageLoaderInterface loader, ExtractionChain chain, PageDiagnostics diagnostics) {
        this(loader, chain, diagnostics, PAGE_URL);
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public String fallbackCompetition() {
        return COMPETITION;
    }

    @Override
    public TeamIdentity resolve(String team) {
        return new TeamIdentity(team, pageUrl);
    }

    @Override
    public PageContent fetch(TeamIdentity identity, LocalDate from, LocalDate to) {
        if (page == null) {
            page = PageContent.html(pageUrl, loader.load(pageUrl));
        } else {
            logger.debug("Reusing {} for {}", pageUrl, identity.team());
        }
        return page;
    }
}
