package com.encarbot.classify;

import com.encarbot.config.Config;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Thresholds for the truly-new heuristic and the notification gate.
 */
public record NewListingCriteria(
        int maxRegistrationAgeDays,
        int recentDays,
        int maxViewsForNew,
        int immediateAlertViews,
        Duration alertWindow,
        List<String> excludeKeywords
) {
    public NewListingCriteria {
        excludeKeywords = excludeKeywords == null ? List.of() : List.copyOf(excludeKeywords);
        alertWindow = alertWindow == null ? Duration.ofMinutes(15) : alertWindow;
    }

    public static NewListingCriteria fromConfig(Config config) {
        return new NewListingCriteria(
                Math.max(0, config.getInt("new_listing.max_registration_age_days", 30)),
                Math.max(0, config.getInt("new_listing.recent_days", 7)),
                Math.max(0, config.getInt("new_listing.max_views_for_new", 100)),
                Math.max(0, config.getInt("new_listing.immediate_alert_views", 10)),
                Duration.ofMinutes(Math.max(1, config.getInt("new_listing.alert_window_minutes", 15))),
                config.getList("filters.exclude_keywords")
        );
    }

    public boolean isExcluded(String title) {
        if (title == null || title.isEmpty() || excludeKeywords.isEmpty()) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (String keyword : excludeKeywords) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
