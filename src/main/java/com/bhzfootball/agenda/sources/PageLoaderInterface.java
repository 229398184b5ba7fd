package com.bhzfootball.agenda.sources;

/**
 * Loads the HTML of a scrape-style page.
 */
public interface PageLoaderInterface {
    /**
     * Loads a page.
     * @param url absolute page URL
     * @return page HTML
     * @throws com.bhzfootball.agenda.http.FetchException when the page cannot be obtained
     */
    String load(String url);
}
