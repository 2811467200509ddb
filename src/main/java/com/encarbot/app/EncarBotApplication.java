package com.encarbot.app;

import com.encarbot.acquisition.AcquisitionClient;
import com.encarbot.browser.BrowserGateway;
import com.encarbot.browser.PlaywrightBrowserGateway;
import com.encarbot.classify.ClassificationPipeline;
import com.encarbot.classify.ListingEnricher;
import com.encarbot.classify.NewListingCriteria;
import com.encarbot.closure.ClosureScanner;
import com.encarbot.config.Config;
import com.encarbot.core.MonitoringCycle;
import com.encarbot.db.Database;
import com.encarbot.db.ListingDao;
import com.encarbot.db.MigrationRunner;
import com.encarbot.db.MonitoringLogDao;
import com.encarbot.db.StoreStatistics;
import com.encarbot.db.SystemStateDao;
import com.encarbot.db.mybatis.MonitoringLogRow;
import com.encarbot.http.HttpTransport;
import com.encarbot.http.JdkHttpTransport;
import com.encarbot.model.CycleType;
import com.encarbot.notify.CompositeNotifier;
import com.encarbot.notify.LogNotifier;
import com.encarbot.notify.MessageFormatter;
import com.encarbot.notify.Notifier;
import com.encarbot.notify.TelegramNotifier;
import com.encarbot.runner.Orchestrator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

public final class EncarBotApplication {
    private static final Logger LOG = LogManager.getLogger(EncarBotApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new EncarBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("encarbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("encarbot", options);
            return 0;
        }

        CycleType once = null;
        if (cmd.hasOption("once")) {
            try {
                once = CycleType.fromLabel(cmd.getOptionValue("once"));
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR: " + e.getMessage());
                return 2;
            }
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            Database database = new Database(
                    readDbUrl(config),
                    readDbUser(config),
                    readDbPass(config),
                    config.getString("db.schema", "encarbot"),
                    config.getBoolean("db.sql_log.enabled", false)
            );
            LOG.info("DB type={} url={} schema={}", database.dialect(), database.maskedJdbcUrl(), database.schema());
            new MigrationRunner().run(database);

            ListingDao listingDao = new ListingDao(database);
            MonitoringLogDao monitoringLogDao = new MonitoringLogDao(database);
            SystemStateDao systemStateDao = new SystemStateDao(database);
            Clock clock = Clock.systemUTC();

            if (cmd.hasOption("status")) {
                return printStatus(listingDao, monitoringLogDao, clock);
            }

            ZoneId zone = ZoneId.of(config.getString("monitor.zone", "Asia/Seoul"));
            HttpTransport transport = new JdkHttpTransport(
                    Duration.ofSeconds(Math.max(3, config.getInt("acquisition.request_timeout_sec", 30))));
            BrowserGateway browser = new PlaywrightBrowserGateway(config);
            MessageFormatter formatter = new MessageFormatter(zone);
            Notifier notifier = buildNotifier(config, transport, formatter, clock);

            AcquisitionClient acquisition = new AcquisitionClient(config, transport, browser, clock);
            ClassificationPipeline pipeline = new ClassificationPipeline(
                    listingDao,
                    NewListingCriteria.fromConfig(config),
                    config.getString("acquisition.detail_url"),
                    clock,
                    zone
            );
            ClosureScanner closureScanner = new ClosureScanner(listingDao, browser, config, clock);

            try (Orchestrator orchestrator = new Orchestrator(
                    config,
                    listingDao,
                    acquisition,
                    pipeline,
                    new ListingEnricher(browser),
                    closureScanner,
                    notifier,
                    monitoringLogDao,
                    systemStateDao,
                    clock
            )) {
                Thread mainThread = Thread.currentThread();
                Thread hook = new Thread(() -> {
                    orchestrator.requestStop();
                    try {
                        mainThread.join(Duration.ofSeconds(Math.max(1, config.getInt("monitor.listing_timeout_sec", 90)))
                                .toMillis());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }, "encarbot-shutdown");
                Runtime.getRuntime().addShutdownHook(hook);
                try {
                    if (once != null) {
                        MonitoringCycle cycle = orchestrator.runCycle(once);
                        System.out.println(cycle.getSummary());
                        return "FAILED".equals(cycle.status()) ? 1 : 0;
                    }
                    notifier.sendStatus("STARTED", "schedule: " + describeSchedule(orchestrator));
                    int exit = orchestrator.runForever();
                    notifier.sendStatus("STOPPED", "exit=" + exit);
                    return exit;
                } finally {
                    removeShutdownHook(hook);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted.");
            return 130;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            LOG.error("fatal", e);
            return 1;
        }
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is waiting for this thread.
            LOG.debug("shutdown in progress, hook stays registered");
        }
    }

    private int printStatus(ListingDao listingDao, MonitoringLogDao monitoringLogDao, Clock clock) throws Exception {
        StoreStatistics stats = listingDao.statistics(clock.instant());
        System.out.println("listings total=" + stats.total()
                + " active=" + stats.active()
                + " closed=" + stats.closed()
                + " coupe=" + stats.coupe()
                + " lease=" + stats.lease()
                + " truly_new=" + stats.trulyNew()
                + " first_seen_24h=" + stats.firstSeenLast24h());
        if (!stats.closuresByReason().isEmpty()) {
            System.out.println("closures " + stats.closuresByReason());
        }
        for (MonitoringLogRow row : monitoringLogDao.recent(10)) {
            System.out.println(row.getLoggedAt() + " " + row.getAction() + " " + row.getDetails());
        }
        return 0;
    }

    private Notifier buildNotifier(Config config, HttpTransport transport, MessageFormatter formatter, Clock clock) {
        List<Notifier> channels = new ArrayList<>();
        channels.add(new LogNotifier(formatter, clock));
        TelegramNotifier.Settings telegram = TelegramNotifier.loadSettings(config);
        if (telegram.isUsable()) {
            channels.add(new TelegramNotifier(telegram, transport, formatter, clock));
        } else if (telegram.enabled) {
            LOG.warn("telegram enabled but bot token or chat id missing; alerts go to the log only");
        }
        return new CompositeNotifier(channels);
    }

    private String describeSchedule(Orchestrator orchestrator) {
        List<String> parts = new ArrayList<>();
        orchestrator.schedule().forEach(s -> parts.add(s.type().label() + "=" + s.cadence()));
        return String.join(", ", parts);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (EncarBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("encarbot.log.dir", logDir.toAbsolutePath().toString());

                // Log4j must be initialized before the swap so the console appender keeps the real streams.
                LogManager.getLogger(EncarBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("once").hasArg().argName("cycle")
                .desc("run one cycle and exit: population, regular, quick, closure, cleanup, daily_summary").build());
        options.addOption(Option.builder().longOpt("status").desc("print store statistics and recent cycles").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private String readDbUrl(Config config) {
        return firstNonBlank(System.getenv("ENCARBOT_DB_URL"), config.getString("db.url"));
    }

    private String readDbUser(Config config) {
        return firstNonBlank(System.getenv("ENCARBOT_DB_USER"), config.getString("db.user"));
    }

    private String readDbPass(Config config) {
        return firstNonBlank(System.getenv("ENCARBOT_DB_PASS"), config.getString("db.pass"));
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
