package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.LeaseTerms;
import com.encarbot.model.Listing;
import com.encarbot.price.PriceNormalizer;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text message bodies shared by every channel.
 */
public final class MessageFormatter {
    private static final String RULE = "=".repeat(40);
    private static final int HOT_VIEWS = 10;

    private final ZoneId zone;
    private final DateTimeFormatter timestampFormat;

    public MessageFormatter(ZoneId zone) {
        this.zone = zone;
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(zone);
    }

    public String listingAlert(Listing listing, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append("NEW LISTING ALERT - ").append(timestampFormat.format(now)).append('\n');
        sb.append(RULE).append('\n');
        sb.append("Model: ").append(safe(listing.getTitle())).append('\n');
        if (listing.getYear() != null) {
            sb.append("Year: ").append(listing.getYear()).append('\n');
        }
        sb.append("Price: ").append(priceText(listing)).append('\n');
        if (listing.getMileage() != null) {
            sb.append("Mileage: ").append(String.format(Locale.US, "%,d km", listing.getMileage())).append('\n');
        }
        sb.append("Views: ").append(listing.getViewCount()).append('\n');
        if (listing.getRegistrationDate() != null) {
            sb.append("Registration: ").append(listing.getRegistrationDate());
            if (listing.getDaysSinceRegistration() != null) {
                sb.append(" (").append(listing.getDaysSinceRegistration()).append(" days ago)");
            }
            sb.append('\n');
        }
        sb.append("URL: ").append(safe(listing.getListingUrl())).append('\n');
        sb.append("Car ID: ").append(listing.getId());
        return sb.toString();
    }

    public String listingSummary(Listing listing) {
        StringBuilder sb = new StringBuilder(safe(listing.getTitle()));
        if (listing.getYear() != null) {
            sb.append(" (").append(listing.getYear()).append(')');
        }
        sb.append(" - ").append(priceText(listing));
        if (listing.getViewCount() > 0) {
            sb.append(" - ").append(listing.getViewCount()).append(" views");
            if (listing.getViewCount() <= HOT_VIEWS) {
                sb.append(" (fresh)");
            }
        }
        if (listing.getRegistrationDate() != null) {
            sb.append(" - Reg: ").append(listing.getRegistrationDate());
            if (listing.getDaysSinceRegistration() != null) {
                sb.append(" (").append(listing.getDaysSinceRegistration()).append("d)");
            }
        }
        sb.append("\n    URL: ").append(safe(listing.getListingUrl()));
        return sb.toString();
    }

    public String batchAlert(List<Listing> listings, String summary, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append("NEW ENCAR LISTINGS - ").append(timestampFormat.format(now)).append('\n');
        sb.append(RULE).append('\n');
        sb.append("Found ").append(listings.size()).append(" truly new coupe listing(s)\n\n");
        for (int i = 0; i < listings.size(); i++) {
            sb.append('[').append(i + 1).append("] ").append(listingSummary(listings.get(i))).append('\n');
        }
        if (summary != null && !summary.isBlank()) {
            sb.append('\n').append(summary.trim()).append('\n');
        }
        return sb.toString().trim();
    }

    public String cycleReport(MonitoringCycle cycle) {
        return "CYCLE " + cycle.type().label().toUpperCase(Locale.ROOT)
                + " " + cycle.status()
                + " (" + cycle.totalElapsedMs() + " ms)\n"
                + cycle.getShortSummary();
    }

    public String status(String status, String details, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(timestampFormat.format(now)).append("] MONITOR STATUS: ").append(safe(status));
        if (details != null && !details.isBlank()) {
            sb.append('\n').append(details.trim());
        }
        return sb.toString();
    }

    public String error(String context, Throwable error, Instant now) {
        StringBuilder sb = new StringBuilder();
        sb.append("ENCAR MONITOR ERROR - ").append(timestampFormat.format(now)).append('\n');
        sb.append(RULE).append('\n');
        String message = error == null ? "unknown" : error.getMessage();
        sb.append("Error: ").append(message == null ? error.getClass().getSimpleName() : message).append('\n');
        if (context != null && !context.isBlank()) {
            sb.append("Context: ").append(context.trim());
        }
        return sb.toString().trim();
    }

    public ZoneId zone() {
        return zone;
    }

    static String priceText(Listing listing) {
        LeaseTerms terms = listing.getLeaseTerms();
        if (listing.isLease() && terms != null && terms.isComplete()) {
            return "lease " + PriceNormalizer.formatManwon(listing.getTrueCost())
                    + " total (" + PriceNormalizer.formatManwon(terms.monthlyPayment())
                    + " x " + terms.termMonths() + ")";
        }
        return PriceNormalizer.formatManwon(listing.getListedPrice());
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
