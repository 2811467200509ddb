package com.encarbot.browser;

import com.encarbot.config.Config;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.WaitUntilState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Playwright-backed gateway. A Playwright driver is bound to the thread that created it,
 * so every call starts its own driver and browser and closes them in {@code finally}.
 */
public final class PlaywrightBrowserGateway implements BrowserGateway {
    private static final Logger LOG = LogManager.getLogger(PlaywrightBrowserGateway.class);

    static final String NO_DATA_SELECTOR =
            "[class*=\"DetailNone_no_data\"], [class*=\"DetailNone\"], .DetailNone_text, [class*=\"no_data\"]";
    static final String ERROR_ELEMENT_SELECTOR =
            ".error-page, .not-found-page, [class*=\"error\"], [class*=\"notfound\"], [class*=\"404\"]";
    private static final int MAX_PROBED_ELEMENTS = 10;

    private final boolean headless;
    private final double navigationTimeoutMs;
    private final double settleMs;

    public PlaywrightBrowserGateway(Config config) {
        this.headless = config.getBoolean("browser.headless", true);
        this.navigationTimeoutMs = Math.max(1000, config.getInt("browser.navigation_timeout_ms", 30_000));
        this.settleMs = Math.max(0, config.getInt("browser.settle_ms", 3_000));
    }

    @Override
    public SessionSnapshot harvestSession(String url) throws BrowserException {
        Playwright pw = null;
        Browser browser = null;
        BrowserContext context = null;
        Page page = null;
        try {
            pw = Playwright.create();
            browser = launchBrowser(pw);
            context = browser.newContext();
            page = context.newPage();
            try {
                page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                        .setTimeout(navigationTimeoutMs));
                page.waitForTimeout(settleMs);
                LOG.info("session page loaded title={} url={}", page.title(), page.url());
            } catch (PlaywrightException e) {
                // cookies set before the failure are still usable
                LOG.warn("session page navigation issue url={} err={}", url, firstLine(e.getMessage()));
            }
            Map<String, String> cookies = new LinkedHashMap<>();
            for (Cookie cookie : context.cookies()) {
                cookies.put(cookie.name, cookie.value);
            }
            Object userAgent = page.evaluate("navigator.userAgent");
            return new SessionSnapshot(cookies, userAgent == null ? "" : userAgent.toString(), page.url());
        } catch (PlaywrightException e) {
            throw new BrowserException("session harvest failed: " + firstLine(e.getMessage()), e);
        } finally {
            safeClose(page);
            safeClose(context);
            safeClose(browser);
            safeClose(pw);
        }
    }

    @Override
    public String fetchText(String url) throws BrowserException {
        Playwright pw = null;
        Browser browser = null;
        BrowserContext context = null;
        Page page = null;
        try {
            pw = Playwright.create();
            browser = launchBrowser(pw);
            context = browser.newContext();
            page = context.newPage();
            Response response = page.navigate(url, new Page.NavigateOptions().setTimeout(navigationTimeoutMs));
            if (response == null) {
                throw new BrowserException("no response from " + url);
            }
            if (response.status() != 200) {
                throw new BrowserException("browser fetch status=" + response.status());
            }
            Document document = Jsoup.parse(page.content());
            Element pre = document.selectFirst("pre");
            if (pre != null) {
                return pre.wholeText();
            }
            Object text = page.evaluate("document.body.innerText");
            return text == null ? "" : text.toString();
        } catch (PlaywrightException e) {
            throw new BrowserException("browser fetch failed: " + firstLine(e.getMessage()), e);
        } finally {
            safeClose(page);
            safeClose(context);
            safeClose(browser);
            safeClose(pw);
        }
    }

    @Override
    public RenderedPage render(String url) throws BrowserException {
        Playwright pw = null;
        Browser browser = null;
        BrowserContext context = null;
        Page page = null;
        try {
            pw = Playwright.create();
            browser = launchBrowser(pw);
            context = browser.newContext();
            page = context.newPage();
            Response response = page.navigate(url, new Page.NavigateOptions().setTimeout(navigationTimeoutMs));
            if (response == null) {
                return RenderedPage.noResponse(url);
            }
            int status = response.status();
            if (status >= 400) {
                return new RenderedPage(status, page.title(), page.url(), "", "", List.of(), List.of());
            }
            page.waitForTimeout(settleMs);
            Object bodyText = page.evaluate("document.body ? document.body.innerText : ''");
            return new RenderedPage(
                    status,
                    page.title(),
                    page.url(),
                    page.content(),
                    bodyText == null ? "" : bodyText.toString(),
                    probeTexts(page, NO_DATA_SELECTOR),
                    probeTexts(page, ERROR_ELEMENT_SELECTOR)
            );
        } catch (PlaywrightException e) {
            throw new BrowserException("render failed url=" + url + " err=" + firstLine(e.getMessage()), e);
        } finally {
            safeClose(page);
            safeClose(context);
            safeClose(browser);
            safeClose(pw);
        }
    }

    private Browser launchBrowser(Playwright pw) {
        return pw.chromium().launch(new BrowserType.LaunchOptions()
                .setHeadless(headless)
                .setTimeout(navigationTimeoutMs)
                .setArgs(List.of("--disable-dev-shm-usage", "--no-sandbox")));
    }

    private List<String> probeTexts(Page page, String selector) {
        List<String> out = new ArrayList<>();
        for (ElementHandle element : page.querySelectorAll(selector)) {
            if (out.size() >= MAX_PROBED_ELEMENTS) {
                break;
            }
            String text = element.textContent();
            if (text != null && !text.isBlank()) {
                out.add(text.trim());
            }
        }
        return out;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static void safeClose(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            LOG.debug("browser resource close failed: {}", e.getMessage());
        }
    }
}
