package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.Listing;

import java.util.ArrayList;
import java.util.List;

public final class RecordingNotifier implements Notifier {
    public final List<Listing> listingAlerts = new ArrayList<>();
    public final List<List<Listing>> batches = new ArrayList<>();
    public final List<MonitoringCycle> cycleReports = new ArrayList<>();
    public final List<String> statuses = new ArrayList<>();
    public final List<String> errors = new ArrayList<>();

    @Override
    public synchronized boolean sendListingAlert(Listing listing) {
        listingAlerts.add(listing);
        return true;
    }

    @Override
    public synchronized boolean sendBatchAlert(List<Listing> listings, String summary) {
        batches.add(List.copyOf(listings));
        return true;
    }

    @Override
    public synchronized boolean sendCycleReport(MonitoringCycle cycle) {
        cycleReports.add(cycle);
        return true;
    }

    @Override
    public synchronized boolean sendStatus(String status, String details) {
        statuses.add(status + "\n" + details);
        return true;
    }

    @Override
    public synchronized boolean sendError(String context, Throwable error) {
        errors.add(context + ": " + error.getMessage());
        return true;
    }
}
