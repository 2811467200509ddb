package com.encarbot.runner;

import com.encarbot.acquisition.AcquisitionClient;
import com.encarbot.acquisition.AcquisitionException;
import com.encarbot.acquisition.PagedScan;
import com.encarbot.acquisition.QueryBuilder;
import com.encarbot.acquisition.SearchFilter;
import com.encarbot.browser.BrowserException;
import com.encarbot.classify.ClassificationPipeline;
import com.encarbot.classify.ListingEnricher;
import com.encarbot.closure.ClosureScanResult;
import com.encarbot.closure.ClosureScanner;
import com.encarbot.config.Config;
import com.encarbot.core.MonitoringCycle;
import com.encarbot.db.ListingStore;
import com.encarbot.db.MonitoringLogDao;
import com.encarbot.db.PersistenceException;
import com.encarbot.db.StoreStatistics;
import com.encarbot.db.SystemStateDao;
import com.encarbot.model.ClosureReason;
import com.encarbot.model.CycleType;
import com.encarbot.model.Listing;
import com.encarbot.model.ListingDetail;
import com.encarbot.model.SearchItem;
import com.encarbot.notify.Notifier;
import com.encarbot.price.PriceNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs monitoring cycles on their cadences.
 *
 * <p>Cycles never overlap: the tick loop runs due cycles one after another and a lock
 * guards {@link #runCycle(CycleType)} for callers outside the loop. Per-listing work is
 * handed to a single worker thread and awaited with a hard timeout, so a hung page costs
 * one error instead of the cycle. A stop request lets the listing in flight finish, then
 * ends the cycle as interrupted.
 */
public final class Orchestrator implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(Orchestrator.class);
    private static final String LAST_RUN_PREFIX = "last_run.";
    private static final long SLEEP_CHUNK_MS = 1_000L;

    private final Config config;
    private final ListingStore store;
    private final AcquisitionClient acquisition;
    private final ClassificationPipeline pipeline;
    private final ListingEnricher enricher;
    private final ClosureScanner closureScanner;
    private final Notifier notifier;
    private final MonitoringLogDao monitoringLogDao;
    private final SystemStateDao systemStateDao;
    private final Clock clock;
    private final ZoneId zone;
    private final List<ScheduledCycle> schedule;
    private final String query;
    private final Duration listingTimeout;
    private final Duration tick;

    private final ExecutorService worker;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ReentrantLock runLock = new ReentrantLock();

    public Orchestrator(
            Config config,
            ListingStore store,
            AcquisitionClient acquisition,
            ClassificationPipeline pipeline,
            ListingEnricher enricher,
            ClosureScanner closureScanner,
            Notifier notifier,
            MonitoringLogDao monitoringLogDao,
            SystemStateDao systemStateDao,
            Clock clock
    ) {
        this.config = config;
        this.store = store;
        this.acquisition = acquisition;
        this.pipeline = pipeline;
        this.enricher = enricher;
        this.closureScanner = closureScanner;
        this.notifier = notifier;
        this.monitoringLogDao = monitoringLogDao;
        this.systemStateDao = systemStateDao;
        this.clock = clock;
        this.zone = ZoneId.of(config.getString("monitor.zone", "Asia/Seoul"));
        this.schedule = ScheduledCycle.fromConfig(config);
        this.query = QueryBuilder.build(SearchFilter.fromConfig(config));
        this.listingTimeout = Duration.ofSeconds(Math.max(1, config.getInt("monitor.listing_timeout_sec", 90)));
        this.tick = Duration.ofSeconds(Math.max(1, config.getInt("monitor.tick_seconds", 30)));
        this.worker = Executors.newSingleThreadExecutor(new WorkerThreadFactory());
    }

    public List<ScheduledCycle> schedule() {
        return schedule;
    }

    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOG.info("stop requested; finishing the listing in flight");
        }
    }

    /**
     * Tick loop. Returns 0 after a stop request, 130 when the thread is interrupted.
     */
    public int runForever() {
        Map<CycleType, ZonedDateTime> lastRuns = loadLastRuns(ZonedDateTime.now(clock.withZone(zone)));
        LOG.info("scheduler started zone={} tick={}s cycles={}", zone, tick.toSeconds(), schedule.size());
        while (!stopRequested.get()) {
            for (ScheduledCycle scheduled : schedule) {
                if (stopRequested.get()) {
                    break;
                }
                ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
                if (!scheduled.cadence().isDue(now, lastRuns.get(scheduled.type()))) {
                    continue;
                }
                try {
                    runCycle(scheduled.type());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("scheduler interrupted");
                    return 130;
                }
                lastRuns.put(scheduled.type(), now);
            }
            if (!sleepTick()) {
                LOG.warn("scheduler interrupted");
                return 130;
            }
        }
        LOG.info("scheduler stopped");
        return 0;
    }

    /**
     * Runs one cycle to completion. Scans against an empty store run as population
     * instead. The returned cycle is already journaled and reported.
     */
    public MonitoringCycle runCycle(CycleType requested) throws InterruptedException {
        runLock.lockInterruptibly();
        try {
            CycleType type = resolve(requested);
            MonitoringCycle cycle = new MonitoringCycle(type, clock.instant());
            LOG.info("cycle {} started", type.label());
            try {
                switch (type) {
                    case POPULATION -> runPopulation(cycle);
                    case REGULAR -> runScan(cycle,
                            Math.max(1, config.getInt("regular.base_pages", 3)),
                            Math.max(0, config.getInt("regular.enrich_limit", 5)));
                    case QUICK -> runScan(cycle,
                            Math.max(1, config.getInt("quick.pages", 1)),
                            Math.max(0, config.getInt("quick.enrich_limit", 0)));
                    case CLOSURE -> runClosure(cycle);
                    case CLEANUP -> runCleanup(cycle);
                    case DAILY_SUMMARY -> runDailySummary(cycle);
                }
            } catch (AcquisitionException e) {
                cycle.fail("acquisition " + e.kind().name().toLowerCase(Locale.ROOT) + ": " + e.getMessage());
                LOG.error("cycle {} acquisition failed kind={} attempts={} err={}",
                        type.label(), e.kind(), e.attempts(), e.getMessage());
                notifier.sendError("cycle " + type.label(), e);
            } catch (PersistenceException e) {
                cycle.fail("store " + e.kind().name().toLowerCase(Locale.ROOT) + ": " + e.getMessage());
                LOG.error("cycle {} store failure", type.label(), e);
                notifier.sendError("cycle " + type.label(), e);
            } catch (InterruptedException e) {
                cycle.markInterrupted();
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                cycle.fail(e.getClass().getSimpleName() + ": " + e.getMessage());
                LOG.error("cycle {} failed", type.label(), e);
                notifier.sendError("cycle " + type.label(), e);
            } finally {
                if (stopRequested.get()) {
                    cycle.markInterrupted();
                }
                cycle.finish();
                journal(cycle);
                LOG.info("cycle {} finished {}", type.label(), cycle.getShortSummary());
                notifier.sendCycleReport(cycle);
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("cycle " + type.label() + " interrupted");
            }
            return cycle;
        } finally {
            runLock.unlock();
        }
    }

    @Override
    public void close() {
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("listing worker did not terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    CycleType resolve(CycleType requested) throws InterruptedException {
        if (requested != CycleType.REGULAR && requested != CycleType.QUICK) {
            return requested;
        }
        try {
            if (store.isEmpty()) {
                LOG.info("store is empty; running population instead of {}", requested.label());
                return CycleType.POPULATION;
            }
        } catch (PersistenceException e) {
            LOG.warn("could not check store size, keeping {}: {}", requested.label(), e.getMessage());
        }
        return requested;
    }

    private void runPopulation(MonitoringCycle cycle) throws AcquisitionException, InterruptedException {
        int minPages = Math.max(1, config.getInt("population.min_pages", 10));
        int maxPages = Math.max(minPages, config.getInt("population.max_pages", 50));
        double coverage = config.getDouble("population.target_coverage", 0.8);

        cycle.startStep(MonitoringCycle.STEP_FETCH);
        int total = acquisition.fetchTotalCount(query);
        int pages = Math.min(maxPages, Math.max(minPages, (int) (total * coverage / acquisition.pageSize())));
        LOG.info("population: total={} pages={} (coverage={})", total, pages, coverage);
        PagedScan scan = acquisition.fetchPages(query, pages);
        recordScan(cycle, scan);
        cycle.endStep(MonitoringCycle.STEP_FETCH, pages, scan.items().size(), scan.truncated() ? 1 : 0);

        cycle.startStep(MonitoringCycle.STEP_CLASSIFY);
        int errorsBefore = cycle.errors();
        for (SearchItem item : scan.items()) {
            if (stopRequested.get()) {
                cycle.markInterrupted();
                break;
            }
            onWorker(cycle, "seed " + item.id(), () -> pipeline.seed(item))
                    .ifPresent(result -> cycle.recordClassification(result.label()));
        }
        cycle.endStep(MonitoringCycle.STEP_CLASSIFY, scan.items().size(),
                cycle.newCount() + cycle.updated() + cycle.unchanged(), cycle.errors() - errorsBefore);
    }

    private void runScan(MonitoringCycle cycle, int pages, int enrichLimit)
            throws AcquisitionException, PersistenceException, InterruptedException {
        cycle.startStep(MonitoringCycle.STEP_FETCH);
        PagedScan scan = acquisition.fetchPages(query, pages);
        recordScan(cycle, scan);
        cycle.endStep(MonitoringCycle.STEP_FETCH, pages, scan.items().size(), scan.truncated() ? 1 : 0);

        cycle.startStep(MonitoringCycle.STEP_CLASSIFY);
        int errorsBefore = cycle.errors();
        for (SearchItem item : scan.items()) {
            if (stopRequested.get()) {
                cycle.markInterrupted();
                break;
            }
            onWorker(cycle, "classify " + item.id(), () -> pipeline.classify(item))
                    .ifPresent(result -> cycle.recordClassification(result.label()));
        }
        cycle.endStep(MonitoringCycle.STEP_CLASSIFY, scan.items().size(),
                cycle.newCount() + cycle.updated() + cycle.unchanged(), cycle.errors() - errorsBefore);

        cycle.startStep(MonitoringCycle.STEP_NOTIFY);
        List<Listing> fresh = new ArrayList<>();
        for (Listing listing : pipeline.claimTrulyNew()) {
            if (pipeline.isNotificationWorthy(listing)) {
                fresh.add(listing);
            }
        }
        if (!fresh.isEmpty()) {
            boolean delivered = fresh.size() == 1
                    ? notifier.sendListingAlert(fresh.get(0))
                    : notifier.sendBatchAlert(fresh, batchSummary(fresh));
            if (delivered) {
                cycle.recordNotified(fresh.size());
            } else {
                LOG.warn("alert for {} listing(s) was not delivered", fresh.size());
            }
        }
        cycle.endStep(MonitoringCycle.STEP_NOTIFY, fresh.size(), cycle.notified(), 0);

        if (enrichLimit > 0 && !fresh.isEmpty()) {
            cycle.startStep(MonitoringCycle.STEP_ENRICH);
            int errorsBeforeEnrich = cycle.errors();
            List<Listing> targets = fresh.subList(0, Math.min(enrichLimit, fresh.size()));
            for (Listing listing : targets) {
                if (stopRequested.get()) {
                    cycle.markInterrupted();
                    break;
                }
                onWorker(cycle, "enrich " + listing.getId(), () -> enrich(listing))
                        .ifPresent(enriched -> cycle.recordEnriched());
            }
            cycle.endStep(MonitoringCycle.STEP_ENRICH, targets.size(), cycle.enriched(),
                    cycle.errors() - errorsBeforeEnrich);
        }
    }

    private Listing enrich(Listing listing) throws BrowserException, PersistenceException {
        ListingDetail detail = enricher.fetchDetail(listing);
        return pipeline.applyDetail(listing, detail);
    }

    private void runClosure(MonitoringCycle cycle) throws PersistenceException, InterruptedException {
        cycle.startStep(MonitoringCycle.STEP_CLOSURE_SCAN);
        ClosureScanResult result = closureScanner.scan(stopRequested::get);
        cycle.recordChecked(result.checked());
        for (Map.Entry<ClosureReason, Integer> entry : result.closuresByReason().entrySet()) {
            for (int i = 0; i < entry.getValue(); i++) {
                cycle.recordClosure(entry.getKey());
            }
        }
        for (int i = 0; i < result.errors(); i++) {
            cycle.recordError();
        }
        if (result.stopped()) {
            cycle.markInterrupted();
        }
        cycle.endStep(MonitoringCycle.STEP_CLOSURE_SCAN, result.checked(), result.closed(), result.errors());
        LOG.info("closure scan {}", result);
    }

    private void runCleanup(MonitoringCycle cycle) throws PersistenceException {
        int retentionDays = Math.max(1, config.getInt("cleanup.retention_days", 90));
        Instant horizon = clock.instant().minus(Duration.ofDays(retentionDays));
        cycle.startStep(MonitoringCycle.STEP_CLEANUP);
        int deleted = store.deleteNotUpdatedSince(horizon);
        cycle.recordDeleted(deleted);
        cycle.endStep(MonitoringCycle.STEP_CLEANUP, 0, deleted, 0);
        LOG.info("cleanup removed {} listing(s) not updated since {}", deleted, horizon);
    }

    private void runDailySummary(MonitoringCycle cycle) throws PersistenceException {
        Instant now = clock.instant();
        StoreStatistics stats = store.statistics(now);
        List<Listing> recent = store.findFirstSeenSince(now.minus(Duration.ofHours(24)));
        cycle.recordChecked(stats.total());

        StringBuilder sb = new StringBuilder();
        sb.append("total=").append(stats.total())
                .append(" active=").append(stats.active())
                .append(" closed=").append(stats.closed()).append('\n');
        sb.append("coupe=").append(stats.coupe())
                .append(" lease=").append(stats.lease())
                .append(" truly_new=").append(stats.trulyNew()).append('\n');
        sb.append("first seen in 24h: ").append(stats.firstSeenLast24h());
        if (!stats.closuresByReason().isEmpty()) {
            sb.append('\n').append("closures: ").append(stats.closuresByReason());
        }
        int shown = 0;
        for (Listing listing : recent) {
            if (!listing.isCoupe() || listing.isClosed()) {
                continue;
            }
            if (shown++ >= 10) {
                break;
            }
            sb.append('\n').append("- ").append(listing.getTitle())
                    .append(" ").append(PriceNormalizer.formatManwon(listing.getTrueCost()));
        }
        if (notifier.sendStatus("DAILY SUMMARY", sb.toString())) {
            cycle.recordNotified(1);
        }
    }

    private void recordScan(MonitoringCycle cycle, PagedScan scan) {
        for (var page : scan.pages()) {
            cycle.recordPage(page.items().size());
        }
        if (scan.truncated()) {
            cycle.recordError();
        }
    }

    private <T> Optional<T> onWorker(MonitoringCycle cycle, String what, Callable<T> task) throws InterruptedException {
        Future<T> future = worker.submit(task);
        try {
            return Optional.ofNullable(future.get(listingTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            cycle.recordError();
            LOG.warn("{} timed out after {}s", what, listingTimeout.toSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            cycle.recordError();
            LOG.warn("{} failed: {}", what, cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
        return Optional.empty();
    }

    private static String batchSummary(List<Listing> listings) {
        double min = Double.MAX_VALUE;
        for (Listing listing : listings) {
            min = Math.min(min, listing.getTrueCost());
        }
        return listings.size() + " new listing(s), lowest " + PriceNormalizer.formatManwon(min);
    }

    private void journal(MonitoringCycle cycle) {
        String action = cycle.type().label();
        try {
            monitoringLogDao.append(clock.instant(), action, cycle.getShortSummary(), cycle.newCount(), cycle.scanned());
            systemStateDao.putInstant(LAST_RUN_PREFIX + action, cycle.startedAt());
        } catch (SQLException e) {
            LOG.error("failed to journal cycle {}: {}", action, e.getMessage(), e);
        }
    }

    private Map<CycleType, ZonedDateTime> loadLastRuns(ZonedDateTime startedAt) {
        Map<CycleType, ZonedDateTime> lastRuns = new EnumMap<>(CycleType.class);
        for (ScheduledCycle scheduled : schedule) {
            Optional<Instant> stored = Optional.empty();
            try {
                stored = systemStateDao.getInstant(LAST_RUN_PREFIX + scheduled.type().label());
            } catch (SQLException e) {
                LOG.warn("failed to read last run of {}: {}", scheduled.type().label(), e.getMessage());
            }
            if (stored.isPresent()) {
                lastRuns.put(scheduled.type(), stored.get().atZone(zone));
            } else if (!scheduled.cadence().runsAtStartup()) {
                lastRuns.put(scheduled.type(), startedAt);
            }
        }
        return lastRuns;
    }

    private boolean sleepTick() {
        long remaining = tick.toMillis();
        while (remaining > 0 && !stopRequested.get()) {
            long chunk = Math.min(SLEEP_CHUNK_MS, remaining);
            try {
                Thread.sleep(chunk);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            remaining -= chunk;
        }
        return true;
    }

    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "encarbot-listing-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
