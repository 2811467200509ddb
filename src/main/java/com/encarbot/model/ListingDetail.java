package com.encarbot.model;

/**
 * Detail scraped from a rendered listing page. {@code leaseTerms} is null when the page
 * carries no lease vocabulary.
 */
public record ListingDetail(int viewCount, String registrationDate, LeaseTerms leaseTerms) {
    public ListingDetail {
        viewCount = Math.max(0, viewCount);
        registrationDate = registrationDate == null || registrationDate.isBlank() ? null : registrationDate.trim();
    }

    public boolean isEmpty() {
        return viewCount == 0 && registrationDate == null && leaseTerms == null;
    }
}
