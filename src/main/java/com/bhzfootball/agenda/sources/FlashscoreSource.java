package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.extract.ExtractionChain;
import com.bhzfootball.agenda.extract.PageContent;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * FlashScore team fixture pages, one per team.
 */
public class FlashscoreSource extends ScrapedPageSource {

    public static final String TAG = "flashscore";
    public static final String COMPETITION = "FlashScore";

    public static final Map<String, String> DEFAULT_TEAM_PAGES = Map.of(
        "Cruzeiro", "https://www.flashscore.com/team/cruzeiro/0SwtclaU/",
        "Atletico-MG", "https://www.flashscore.com/team/atletico-mg/hGLC5Bah/",
        "America-MG", "https://www.flashscore.com/team/america-mg/xUT0Bp8o/"
    );

    private final Map<String, String> teamPages;

    public FlashscoreSource(PageLoaderInterface loader, ExtractionChain chain, PageDiagnostics diagnostics,
                            Map<String, String> teamPages) {
        super(loader, chain, diagnostics);
        this.teamPages = new LinkedHashMap<>(teamPages);
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
        String page = teamPages.get(team);
        if (page == null) throw new UnresolvableIdentityException(TAG, team);
        return new TeamIdentity(team, page);
    }

    @Override
    public PageContent fetch(TeamIdentity identity, LocalDate from, LocalDate to) {
        String url = fixturesUrl(identity.id());
        return PageContent.html(url, loader.load(url));
    }

    static String fixturesUrl(String teamPage) {
        return (teamPage.endsWith("/") ? teamPage : teamPage + "/") + "fixtures/";
    }
}
