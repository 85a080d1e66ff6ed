package com.rymharvest.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.Supplier;

/**
 * Fetches Rate Your Music pages with a headless Chromium driven by Playwright.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Launches one browser on first use and reuses it for every fetch until {@link #close()}.</li>
 *   <li>Opens a fresh page per URL, navigates, and waits for network idle plus a readiness selector.</li>
 *   <li>Hands the rendered HTML to jsoup so scrapers query it with CSS selectors.</li>
 *   <li>Navigation failures and HTTP error statuses become {@link FetchException}.</li>
 * </ul>
 * Requests run one at a time; the fetcher is not meant to be shared between threads.
 *
 * @author RYM Harvest Team
 * @since 1.0
 */
public class PlaywrightPageFetcher implements PageFetcherInterface, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightPageFetcher.class);
    private static final String BASE_URL = "https://rateyourmusic.com";
    private static final String READY_SELECTOR = "#content, body";

    private final int timeoutMs;
    private final Supplier<Playwright> playwrightFactory;
    private Playwright playwright;
    private Browser browser;

    public PlaywrightPageFetcher(int timeoutMs) {
        this(timeoutMs, Playwright::create);
    }

    PlaywrightPageFetcher(int timeoutMs, Supplier<Playwright> playwrightFactory) {
        this.timeoutMs = timeoutMs;
        this.playwrightFactory = playwrightFactory;
    }

    public Document fetch(String url) throws FetchException {
        String target = toAbsoluteUrl(url);
        if (target == null || target.isBlank()) {
            throw new FetchException(url, "No URL to fetch");
        }
        Page page = null;
        try {
            page = browser().newPage();
            page.setDefaultTimeout(timeoutMs);
            page.setDefaultNavigationTimeout(timeoutMs);
            Response response = page.navigate(target);
            if (response == null) {
                throw new FetchException(target, "No response for " + target);
            }
            if (response.status() >= 400) {
                throw new FetchException(target, "HTTP " + response.status() + " for " + target);
            }
            waitForPageReady(page, READY_SELECTOR, timeoutMs);
            String html = page.content();
            logger.debug("Fetched {} ({} chars)", target, html.length());
            return Jsoup.parse(html, target);
        } catch (PlaywrightException e) {
            logger.warn("Failed to fetch {}: {}", target, e.getMessage());
            throw new FetchException(target, "Failed to fetch " + target + ": " + e.getMessage(), e);
        } finally {
            if (page != null) {
                try {
                    page.close();
                } catch (PlaywrightException e) {
                    logger.debug("Failed to close page for {}: {}", target, e.getMessage());
                }
            }
        }
    }

    /**
     * Launches the browser on first use. A Playwright instance created for a launch that fails is closed again.
     */
    private Browser browser() {
        if (browser != null) return browser;
        Playwright driver = playwrightFactory.get();
        try {
            browser = driver.chromium().launch(getDefaultLaunchOptions());
        } catch (PlaywrightException e) {
            try {
                driver.close();
            } catch (PlaywrightException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        playwright = driver;
        logger.info("Launched headless Chromium for page fetching.");
        return browser;
    }

    /**
     * Waits for page to reach NETWORKIDLE and for a key selector to appear.
     * A timeout here is logged and the page content is used as it stands.
     */
    private void waitForPageReady(Page page, String selector, int maxWaitMs) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(maxWaitMs));
            page.waitForSelector(selector, new Page.WaitForSelectorOptions().setTimeout(maxWaitMs));
        } catch (PlaywrightException e) {
            logger.warn("Timeout or error waiting for page ready (selector: {}): {}", selector, e.getMessage());
        }
    }

    private BrowserType.LaunchOptions getDefaultLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(true);
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=1280x1696",
            "--lang=en-US"
        ));
        return options;
    }

    static String toAbsoluteUrl(String url) {
        if (url == null) return null;
        if (url.startsWith("http")) return url;
        if (url.startsWith("/")) return BASE_URL + url;
        return url;
    }

    @Override
    public void close() {
        if (browser != null) browser.close();
        if (playwright != null) playwright.close();
        browser = null;
        playwright = null;
    }
}
