package com.encarbot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A tracked marketplace listing. Prices are in 만원. Instances are working copies; the
 * store owns the durable row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Listing {
    private String id;
    private String title;
    private String model;
    private String badge;
    private Integer year;
    private Integer mileage;

    private double listedPrice;
    private double trueCost;
    private boolean lease;
    private LeaseTerms leaseTerms;

    private Instant firstSeenAt;
    private Instant lastUpdatedAt;
    private int viewCount;
    private String registrationDate;
    private Integer daysSinceRegistration;
    private String listingUrl;

    private boolean coupe;
    private boolean trulyNew;
    private boolean closed;
    private Instant closureDetectedAt;
    private ClosureReason closureReason;

    public boolean hasBrowserDetail() {
        return viewCount > 0 || (registrationDate != null && !registrationDate.isBlank());
    }

    public boolean hasLeaseDetail() {
        return leaseTerms != null && leaseTerms.hasAnyComponent();
    }
}
