package com.encarbot.classify;

import java.util.Optional;

/**
 * Decides whether a listing that the store has never seen is genuinely new on the
 * marketplace, as opposed to an old listing this monitor simply had not picked up yet.
 * Any of three signals qualifies; a registration older than the staleness window
 * disqualifies regardless of views.
 */
public final class TrulyNewRule {
    public enum Reason {
        RECENT_LOW_VIEWS,
        UNDATED_LOW_VIEWS,
        WITHIN_MAX_AGE
    }

    private final NewListingCriteria criteria;

    public TrulyNewRule(NewListingCriteria criteria) {
        this.criteria = criteria;
    }

    public Optional<Reason> evaluate(Integer daysSinceRegistration, int viewCount) {
        if (daysSinceRegistration == null) {
            return viewCount <= criteria.immediateAlertViews()
                    ? Optional.of(Reason.UNDATED_LOW_VIEWS)
                    : Optional.empty();
        }
        int days = Math.max(0, daysSinceRegistration);
        if (days > criteria.maxRegistrationAgeDays()) {
            return Optional.empty();
        }
        if (days <= criteria.recentDays() && viewCount < criteria.maxViewsForNew()) {
            return Optional.of(Reason.RECENT_LOW_VIEWS);
        }
        return Optional.of(Reason.WITHIN_MAX_AGE);
    }
}
