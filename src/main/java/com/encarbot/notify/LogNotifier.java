package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.Listing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;

/**
 * Writes every alert to the {@code ALERTS} logger, which log4j2.xml routes to its own
 * file. Always enabled.
 */
public final class LogNotifier implements Notifier {
    private static final Logger ALERTS = LogManager.getLogger("ALERTS");

    private final MessageFormatter formatter;
    private final Clock clock;

    public LogNotifier(MessageFormatter formatter, Clock clock) {
        this.formatter = formatter;
        this.clock = clock;
    }

    @Override
    public boolean sendListingAlert(Listing listing) {
        ALERTS.info("\n{}", formatter.listingAlert(listing, clock.instant()));
        return true;
    }

    @Override
    public boolean sendBatchAlert(List<Listing> listings, String summary) {
        ALERTS.info("\n{}", formatter.batchAlert(listings, summary, clock.instant()));
        return true;
    }

    @Override
    public boolean sendCycleReport(MonitoringCycle cycle) {
        ALERTS.info(formatter.cycleReport(cycle));
        return true;
    }

    @Override
    public boolean sendStatus(String status, String details) {
        ALERTS.info(formatter.status(status, details, clock.instant()));
        return true;
    }

    @Override
    public boolean sendError(String context, Throwable error) {
        ALERTS.error("\n{}", formatter.error(context, error, clock.instant()));
        return true;
    }
}
