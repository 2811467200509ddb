package com.encarbot.classify;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registration dates as shown on the marketplace: {@code YYYY/MM/DD}, also accepted with
 * '-' or '.' separators. Stored normalized to slashes.
 */
public final class RegistrationDates {
    private static final Pattern DATE = Pattern.compile("(\\d{4})[/.-](\\d{1,2})[/.-](\\d{1,2})");

    private RegistrationDates() {
    }

    public static Optional<LocalDate> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = DATE.matcher(raw.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3))
            ));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static String normalize(String raw) {
        return parse(raw)
                .map(d -> String.format(Locale.ROOT, "%04d/%02d/%02d", d.getYear(), d.getMonthValue(), d.getDayOfMonth()))
                .orElse(null);
    }

    public static Integer daysSince(String raw, Clock clock, ZoneId zone) {
        return parse(raw)
                .map(d -> (int) ChronoUnit.DAYS.between(d, LocalDate.ofInstant(clock.instant(), zone)))
                .orElse(null);
    }
}
