package com.encarbot.model;

/**
 * Lease components in canonical units (만원). Any field may be null when the page did not
 * expose it; derived totals are only available once monthly payment and term are known.
 */
public record LeaseTerms(
        Double deposit,
        Double monthlyPayment,
        Integer termMonths,
        Double finalPayment,
        Double vehiclePrice
) {
    public static LeaseTerms empty() {
        return new LeaseTerms(null, null, null, null, null);
    }

    public boolean isComplete() {
        return monthlyPayment != null && termMonths != null && termMonths > 0;
    }

    public boolean hasAnyComponent() {
        return deposit != null || monthlyPayment != null || termMonths != null
                || finalPayment != null || vehiclePrice != null;
    }

    public Double totalMonthlyCost() {
        if (!isComplete()) {
            return null;
        }
        return monthlyPayment * termMonths;
    }

    public Double trueCost() {
        if (!isComplete()) {
            return null;
        }
        return orZero(deposit) + totalMonthlyCost() + orZero(finalPayment);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }
}
