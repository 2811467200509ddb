package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.Listing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.function.Predicate;

/**
 * Fans a notification out to several channels. A channel that throws is logged and
 * skipped; the result is true when at least one channel delivered.
 */
public final class CompositeNotifier implements Notifier {
    private static final Logger LOG = LogManager.getLogger(CompositeNotifier.class);

    private final List<Notifier> delegates;

    public CompositeNotifier(List<Notifier> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean sendListingAlert(Listing listing) {
        return fanOut("listing_alert", n -> n.sendListingAlert(listing));
    }

    @Override
    public boolean sendBatchAlert(List<Listing> listings, String summary) {
        return fanOut("batch_alert", n -> n.sendBatchAlert(listings, summary));
    }

    @Override
    public boolean sendCycleReport(MonitoringCycle cycle) {
        return fanOut("cycle_report", n -> n.sendCycleReport(cycle));
    }

    @Override
    public boolean sendStatus(String status, String details) {
        return fanOut("status", n -> n.sendStatus(status, details));
    }

    @Override
    public boolean sendError(String context, Throwable error) {
        return fanOut("error", n -> n.sendError(context, error));
    }

    private boolean fanOut(String kind, Predicate<Notifier> call) {
        boolean delivered = false;
        for (Notifier delegate : delegates) {
            try {
                delivered |= call.test(delegate);
            } catch (RuntimeException e) {
                LOG.warn("notifier {} failed on {}: {}", delegate.getClass().getSimpleName(), kind, e.getMessage());
            }
        }
        return delivered;
    }
}
