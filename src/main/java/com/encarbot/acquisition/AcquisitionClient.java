package com.encarbot.acquisition;

import com.encarbot.browser.BrowserException;
import com.encarbot.browser.BrowserGateway;
import com.encarbot.browser.SessionSnapshot;
import com.encarbot.config.Config;
import com.encarbot.http.HttpResult;
import com.encarbot.http.HttpTransport;
import com.encarbot.model.SearchPage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client for the marketplace list endpoint.
 *
 * <p>Requests go out directly with a session harvested from one headless-browser visit.
 * On failure the client escalates: a 407 is retried through the browser itself; a 401 or
 * 403 (or a failed browser fallback) drops the session so the next attempt rebuilds it;
 * 429 and 5xx are retried as they are. After {@code acquisition.max_attempts} attempts the
 * call fails with {@link AcquisitionException.Kind#EXHAUSTED}.
 *
 * <p>The session belongs to this instance. Rebuilds are serialized by a lock so that
 * concurrent callers never harvest twice for the same expiry.
 */
public final class AcquisitionClient {
    private static final Logger LOG = LogManager.getLogger(AcquisitionClient.class);

    private final String listUrl;
    private final String homeUrl;
    private final String origin;
    private final int pageSize;
    private final int maxAttempts;
    private final long retrySleepMs;
    private final long pagePauseMs;
    private final Duration sessionTtl;
    private final Duration requestTimeout;
    private final HttpTransport transport;
    private final BrowserGateway browser;
    private final Clock clock;

    private final ReentrantLock sessionLock = new ReentrantLock();
    private final AtomicInteger sessionBuilds = new AtomicInteger();
    private volatile AcquisitionSession session;

    public AcquisitionClient(Config config, HttpTransport transport, BrowserGateway browser, Clock clock) {
        this.listUrl = config.getString("acquisition.list_url");
        this.homeUrl = config.getString("acquisition.home_url");
        this.origin = originOf(homeUrl);
        this.pageSize = Math.max(1, config.getInt("acquisition.page_size", 20));
        this.maxAttempts = Math.max(1, config.getInt("acquisition.max_attempts", 3));
        this.retrySleepMs = Math.max(0L, config.getLong("acquisition.retry_sleep_ms", 2000L));
        this.pagePauseMs = Math.max(0L, config.getLong("acquisition.page_pause_ms", 1000L));
        this.sessionTtl = Duration.ofMinutes(Math.max(1, config.getInt("acquisition.session_ttl_minutes", 60)));
        this.requestTimeout = Duration.ofSeconds(Math.max(3, config.getInt("acquisition.request_timeout_sec", 30)));
        this.transport = transport;
        this.browser = browser;
        this.clock = clock;
    }

    public int pageSize() {
        return pageSize;
    }

    /**
     * Fetches one page ordered by modification date. Calling it twice with the same
     * arguments while the session is valid returns the same page, give or take upstream
     * changes.
     */
    public SearchPage fetchPage(String query, int offset, int limit) throws AcquisitionException, InterruptedException {
        String url = listUrl + "?count=true&q=" + encode(query)
                + "&sr=" + encode("|ModifiedDate|" + Math.max(0, offset) + "|" + Math.max(1, limit));
        return execute(url);
    }

    public int fetchTotalCount(String query) throws AcquisitionException, InterruptedException {
        return execute(listUrl + "?count=true&q=" + encode(query)).totalCount();
    }

    /**
     * Walks up to {@code maxPages} pages, stopping at the first short page. A failure on
     * the first page propagates; a later failure ends the walk with what was fetched.
     */
    public PagedScan fetchPages(String query, int maxPages) throws AcquisitionException, InterruptedException {
        List<SearchPage> pages = new ArrayList<>();
        int totalCount = 0;
        for (int page = 0; page < Math.max(1, maxPages); page++) {
            SearchPage result;
            try {
                result = fetchPage(query, page * pageSize, pageSize);
            } catch (AcquisitionException e) {
                if (page == 0) {
                    throw e;
                }
                LOG.warn("page {} failed, keeping {} page(s): {}", page + 1, pages.size(), e.getMessage());
                return new PagedScan(pages, totalCount, e);
            }
            if (page == 0) {
                totalCount = result.totalCount();
            }
            if (result.items().isEmpty()) {
                break;
            }
            pages.add(result);
            if (result.items().size() < pageSize) {
                LOG.info("reached end of listings at page {}", page + 1);
                break;
            }
            if (pagePauseMs > 0 && page + 1 < maxPages) {
                Thread.sleep(pagePauseMs);
            }
        }
        return new PagedScan(pages, totalCount, null);
    }

    /** Number of browser harvests performed so far. */
    public int sessionBuilds() {
        return sessionBuilds.get();
    }

    private SearchPage execute(String url) throws AcquisitionException, InterruptedException {
        String lastError = "";
        Exception lastCause = null;
        boolean anyResponse = false;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AcquisitionSession current;
            try {
                current = ensureSession();
            } catch (BrowserException e) {
                lastError = "session harvest failed: " + e.getMessage();
                lastCause = e;
                LOG.warn("attempt {}/{}: {}", attempt, maxAttempts, lastError);
                pauseBeforeRetry(attempt);
                continue;
            }

            HttpResult result;
            try {
                result = transport.get(url, current.headers(), requestTimeout);
            } catch (IOException e) {
                lastError = "transport: " + e.getMessage();
                lastCause = e;
                LOG.warn("attempt {}/{}: {}", attempt, maxAttempts, lastError);
                pauseBeforeRetry(attempt);
                continue;
            }
            anyResponse = true;
            int status = result.status();
            LOG.debug("attempt {}/{} status={}", attempt, maxAttempts, status);

            if (result.isSuccess()) {
                try {
                    return SearchResponseParser.parse(result.body());
                } catch (JSONException e) {
                    // usually a challenge page served with 200
                    lastError = "unparseable list response: " + e.getMessage();
                    lastCause = e;
                    invalidate(current);
                }
            } else if (status == 407) {
                LOG.warn("proxy rejection (407), retrying through the browser");
                try {
                    SearchPage page = SearchResponseParser.parse(browser.fetchText(url));
                    LOG.info("browser fallback succeeded");
                    return page;
                } catch (BrowserException | JSONException e) {
                    lastError = "browser fallback failed: " + e.getMessage();
                    lastCause = e;
                    invalidate(current);
                }
            } else if (status == 401 || status == 403) {
                lastError = "authorization rejected status=" + status;
                invalidate(current);
            } else if (status == 429 || status >= 500) {
                lastError = "upstream unavailable status=" + status;
            } else {
                throw new AcquisitionException(AcquisitionException.Kind.REJECTED, "http status=" + status, attempt);
            }
            LOG.warn("attempt {}/{}: {}", attempt, maxAttempts, lastError);
            pauseBeforeRetry(attempt);
        }
        AcquisitionException.Kind kind = anyResponse
                ? AcquisitionException.Kind.EXHAUSTED
                : AcquisitionException.Kind.NETWORK;
        throw new AcquisitionException(kind, "gave up after " + maxAttempts + " attempts: " + lastError,
                maxAttempts, lastCause);
    }

    private AcquisitionSession ensureSession() throws BrowserException {
        AcquisitionSession current = session;
        if (current != null && current.isValidAt(clock.instant())) {
            return current;
        }
        sessionLock.lock();
        try {
            current = session;
            if (current != null && current.isValidAt(clock.instant())) {
                return current;
            }
            LOG.info(current == null ? "building acquisition session" : "acquisition session expired, rebuilding");
            SessionSnapshot snapshot = browser.harvestSession(homeUrl);
            String referer = snapshot.pageUrl().isEmpty() ? homeUrl : snapshot.pageUrl();
            AcquisitionSession fresh = AcquisitionSession.from(snapshot, referer, origin, clock.instant(), sessionTtl);
            session = fresh;
            sessionBuilds.incrementAndGet();
            LOG.info("acquisition session ready: {}", fresh);
            return fresh;
        } finally {
            sessionLock.unlock();
        }
    }

    private void invalidate(AcquisitionSession stale) {
        sessionLock.lock();
        try {
            if (session == stale) {
                session = null;
            }
        } finally {
            sessionLock.unlock();
        }
    }

    private void pauseBeforeRetry(int attempt) throws InterruptedException {
        if (attempt < maxAttempts && retrySleepMs > 0) {
            Thread.sleep(retrySleepMs);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String originOf(String url) {
        try {
            URI uri = URI.create(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return "";
            }
            return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
