package com.visualsearch.crawler.crawl.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.visualsearch.crawler.config.CrawlerProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Headless Chromium renderer. Playwright objects are not thread-safe, so renders are
 * serialized on one lock and the browser is launched lazily on first use.
 */
@Component
public class PlaywrightPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightPageRenderer.class);
    private static final List<String> LAUNCH_ARGS = List.of(
        "--disable-dev-shm-usage",
        "--disable-gpu",
        "--no-sandbox",
        "--disable-setuid-sandbox"
    );
    private static final String PAGE_STATE_SCRIPT =
        "name => { const s = window[name]; return s === undefined || s === null ? null : JSON.stringify(s); }";

    private final CrawlerProperties.Browser settings;
    private final ReentrantLock renderLock = new ReentrantLock();

    private Playwright playwright;
    private Browser browser;

    public PlaywrightPageRenderer(CrawlerProperties properties) {
        this.settings = properties.getBrowser();
    }

    @Override
    public RenderedPage render(RenderRequest request) throws InterruptedException {
        renderLock.lockInterruptibly();
        try {
            Browser activeBrowser = ensureBrowser();
            try (BrowserContext context = activeBrowser.newContext(new Browser.NewContextOptions()
                .setUserAgent(request.userAgent())
                .setViewportSize(1920, 1080)
                .setLocale(settings.getLocale())
                .setTimezoneId(settings.getTimezoneId()))) {
                Page page = context.newPage();
                return renderInPage(page, request);
            }
        } catch (PlaywrightException e) {
            log.warn("Browser render failed for {}: {}", request.url(), e.getMessage());
            return RenderedPage.failure(request.url(), 0, RenderedPage.ERROR_NAVIGATION, e.getMessage());
        } finally {
            renderLock.unlock();
        }
    }

    private RenderedPage renderInPage(Page page, RenderRequest request) throws InterruptedException {
        Response response;
        try {
            response = page.navigate(request.url(), new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.NETWORKIDLE)
                .setTimeout(settings.getNavigationTimeoutMs()));
        } catch (TimeoutError e) {
            return RenderedPage.failure(request.url(), 0, RenderedPage.ERROR_TIMEOUT, e.getMessage());
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Render interrupted after navigation");
        }
        int status = response == null ? 0 : response.status();
        if (response != null && !response.ok()) {
            return RenderedPage.failure(request.url(), status, null, response.statusText());
        }

        if (request.markerSelector() != null && !request.markerSelector().isBlank() && settings.getMarkerTimeoutMs() > 0) {
            try {
                page.waitForSelector(request.markerSelector(), new Page.WaitForSelectorOptions()
                    .setTimeout(settings.getMarkerTimeoutMs()));
            } catch (TimeoutError e) {
                log.debug("Marker {} not found on {}", request.markerSelector(), request.url());
            }
        }
        page.waitForLoadState(LoadState.DOMCONTENTLOADED);

        String pageState = null;
        if (request.pageStateVariable() != null && !request.pageStateVariable().isBlank()) {
            Object state = page.evaluate(PAGE_STATE_SCRIPT, request.pageStateVariable());
            pageState = state instanceof String ? (String) state : null;
        }
        return new RenderedPage(
            request.url(),
            page.url(),
            status == 0 ? 200 : status,
            page.content(),
            page.title(),
            pageState,
            null,
            null
        );
    }

    private Browser ensureBrowser() {
        if (browser == null || !browser.isConnected()) {
            closeQuietly();
            log.info("Launching headless Chromium (headless={})", settings.isHeadless());
            playwright = Playwright.create();
            browser = playwright.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(settings.isHeadless())
                .setArgs(LAUNCH_ARGS));
        }
        return browser;
    }

    @PreDestroy
    public void shutdown() {
        renderLock.lock();
        try {
            closeQuietly();
        } finally {
            renderLock.unlock();
        }
    }

    private void closeQuietly() {
        try {
            if (browser != null) {
                browser.close();
            }
            if (playwright != null) {
                playwright.close();
            }
        } catch (PlaywrightException e) {
            log.warn("Failed to close browser cleanly", e);
        } finally {
            browser = null;
            playwright = null;
        }
    }
}
