package com.encarbot.closure;

import com.encarbot.browser.BrowserException;
import com.encarbot.browser.BrowserGateway;
import com.encarbot.browser.RenderedPage;
import com.encarbot.config.Config;
import com.encarbot.db.ListingStore;
import com.encarbot.db.PersistenceException;
import com.encarbot.model.ClosureReason;
import com.encarbot.model.Listing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Revisits active listings and moves the ones that are gone to closed. A listing is
 * closed only on positive evidence; pages that fail to render count as errors and stay
 * active for the next scan.
 */
public final class ClosureScanner {
    private static final Logger LOG = LogManager.getLogger(ClosureScanner.class);

    private final ListingStore store;
    private final BrowserGateway browser;
    private final Clock clock;
    private final int maxListings;
    private final Duration minAge;
    private final long delayMs;

    public ClosureScanner(ListingStore store, BrowserGateway browser, Config config, Clock clock) {
        this.store = store;
        this.browser = browser;
        this.clock = clock;
        this.maxListings = Math.max(1, config.getInt("closure.max_listings", 50));
        this.minAge = Duration.ofHours(Math.max(0, config.getInt("closure.min_age_hours", 24)));
        this.delayMs = Math.max(0L, config.getLong("closure.delay_ms", 2000L));
    }

    public ClosureScanResult scan(BooleanSupplier stopRequested) throws PersistenceException, InterruptedException {
        return scan(maxListings, minAge, stopRequested);
    }

    public ClosureScanResult scan(int limit, Duration minimumAge, BooleanSupplier stopRequested)
            throws PersistenceException, InterruptedException {
        Instant cutoff = clock.instant().minus(minimumAge);
        List<Listing> candidates = store.findActiveForClosureScan(cutoff, limit);
        LOG.info("closure scan: {} active listing(s) first seen before {}", candidates.size(), cutoff);

        ClosureScanResult result = new ClosureScanResult();
        for (int i = 0; i < candidates.size(); i++) {
            if (stopRequested.getAsBoolean()) {
                result.markStopped();
                LOG.info("closure scan stopped after {} listing(s)", result.checked());
                break;
            }
            Listing listing = candidates.get(i);
            LOG.info("[{}/{}] checking {}", i + 1, candidates.size(), listing.getId());
            try {
                Optional<ClosureReason> reason = inspect(listing);
                if (reason.isEmpty()) {
                    result.recordActive();
                } else if (store.markClosed(listing.getId(), reason.get(), clock.instant())) {
                    result.recordClosed(reason.get());
                    LOG.info("marked {} closed ({})", listing.getId(), reason.get().label());
                } else {
                    result.recordAlreadyClosed();
                }
            } catch (ClosureScanException e) {
                result.recordError();
                LOG.warn("closure check failed id={} kind={} err={}", listing.getId(), e.kind(), e.getMessage());
            } catch (PersistenceException e) {
                result.recordError();
                LOG.error("closure write failed id={} kind={}", listing.getId(), e.kind(), e);
            }
            if (delayMs > 0 && i + 1 < candidates.size()) {
                Thread.sleep(delayMs);
            }
        }
        LOG.info("closure scan completed: {}", result);
        return result;
    }

    public Optional<ClosureReason> inspect(Listing listing) throws ClosureScanException {
        RenderedPage page;
        try {
            page = browser.render(listing.getListingUrl());
        } catch (BrowserException e) {
            throw new ClosureScanException(
                    ClosureScanException.Kind.NAVIGATION_FAILED, listing.getId(), e.getMessage(), e);
        }
        if (ClosureDetector.isInconclusive(page)) {
            throw new ClosureScanException(
                    ClosureScanException.Kind.UPSTREAM_STATUS, listing.getId(), "status=" + page.status(), null);
        }
        return ClosureDetector.detect(page);
    }
}
