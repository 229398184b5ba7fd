package com.bhzfootball.agenda.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/**
 * One fetched upstream payload, shared by every strategy of an {@link ExtractionChain}.
 * HTML is parsed with jsoup on first use; API responses arrive already parsed as JSON.
 */
public final class PageContent {
    private final String url;
    private final String body;
    private final JsonNode json;
    private Document document;
    private String flatText;

    private PageContent(String url, String body, JsonNode json) {
        this.url = url;
        this.body = body == null ? "" : body;
        this.json = json;
    }

    public static PageContent html(String url, String body) {
        return new PageContent(url, body, null);
    }

    public static PageContent json(String url, JsonNode json) {
        return new PageContent(url, json == null ? "" : json.toString(), json);
    }

    public String url() {
        return url;
    }

    public String body() {
        return body;
    }

    /**
     * Parsed JSON body, or null for HTML pages.
     */
    public JsonNode json() {
        return json;
    }

    public Document document() {
        if (document == null) {
            document = Jsoup.parse(body, url == null ? "" : url);
        }
        return document;
    }

    /**
     * Whitespace-collapsed visible text of the page.
     */
    public String flatText() {
        if (flatText == null) {
            flatText = document().text();
        }
        return flatText;
    }
}
