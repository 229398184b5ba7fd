package com.bhzfootball.agenda.sources;

import com.bhzfootball.agenda.http.FetchException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Renders pages in headless Chromium through Playwright, for fixture lists built by JavaScript.
 * <p>
 * Workflow:
 * <ul>
 *   <li>The browser is launched on the first load and reused until {@link #close()}.</li>
 *   <li>Each load opens a fresh page, waits for NETWORKIDLE and for the ready selector, then returns the rendered HTML.</li>
 *   <li>A "cookies" consent button is clicked when present, since it hides the list on some sites.</li>
 * </ul>
 *
 * @author BHZ Football Agenda Team
 * @since 1.0
 */
public class BrowserPageLoader implements PageLoaderInterface, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BrowserPageLoader.class);

    /** Selector that signals the fixture list is on screen. */
    public static final String DEFAULT_READY_SELECTOR =
        ".event__match, script[type='application/ld+json'], [class*=jogo], article";

    private final String readySelector;
    private final int timeoutMs;
    private Playwright playwright;
    private Browser browser;

    public BrowserPageLoader(String readySelector, int timeoutMs) {
        this.readySelector = readySelector;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String load(String url) {
        Page page = null;
        try {
            page = browser().newPage();
            page.setDefaultTimeout(timeoutMs);
            page.setDefaultNavigationTimeout(timeoutMs);
            page.navigate(url);
            waitForPageReady(page, readySelector, timeoutMs / 2);
            dismissConsent(page);
            String html = page.content();
            logger.info("Rendered {} ({} chars)", url, html.length());
            return html;
        } catch (PlaywrightException e) {
            throw new FetchException("Browser failed to render " + url + ": " + e.getMessage(), url, e);
        } finally {
            if (page != null) page.close();
        }
    }

    private Browser browser() {
        if (browser == null) {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(getDefaultLaunchOptions());
        }
        return browser;
    }

    private BrowserType.LaunchOptions getDefaultLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(true);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1280x1696",
            "--lang=pt-BR"
        ));
        return options;
    }

    /**
     * Waits for NETWORKIDLE and then for the selector. A timeout is logged, the content is read anyway.
     */
    private void waitForPageReady(Page page, String selector, int maxWaitMs) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(maxWaitMs));
            if (selector != null && !selector.isBlank()) {
                page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(maxWaitMs));
                logger.debug("Page ready: {} appeared after NETWORKIDLE", selector);
            }
        } catch (PlaywrightException e) {
            logger.warn("Timeout or error waiting for page ready (selector: {}): {}", selector, e.getMessage());
        }
    }

    private void dismissConsent(Page page) {
        var consent = page.locator("#onetrust-accept-btn-handler, button:has-text('Aceitar'), button:has-text('Accept')");
        try {
            if (consent.count() > 0) {
                consent.first().click();
                page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(5_000));
                logger.debug("Dismissed cookie consent");
            }
        } catch (PlaywrightException e) {
            logger.debug("Failed to dismiss cookie consent: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        if (browser != null) browser.close();
        if (playwright != null) playwright.close();
        browser = null;
        playwright = null;
    }
}
