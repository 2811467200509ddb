package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.Listing;

import java.util.List;

/**
 * Outbound alerts. Delivery is best-effort: implementations report failure through the
 * return value and their log, never by throwing, so a failing cycle can still report.
 */
public interface Notifier {

    boolean sendListingAlert(Listing listing);

    boolean sendBatchAlert(List<Listing> listings, String summary);

    boolean sendCycleReport(MonitoringCycle cycle);

    boolean sendStatus(String status, String details);

    boolean sendError(String context, Throwable error);
}
