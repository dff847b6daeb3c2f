package com.awardhub.backend.modules.notification.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders elapsed time with at most two adjacent units, e.g. {@code "2 days, 3 hours"}.
 */
public final class TimeSinceFormatter {

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;
    private static final long WEEK = 7 * DAY;
    private static final long MONTH = 30 * DAY;
    private static final long YEAR = 365 * DAY;

    private static final long[] UNIT_SECONDS = {YEAR, MONTH, WEEK, DAY, HOUR, MINUTE};
    private static final String[] UNIT_NAMES = {"year", "month", "week", "day", "hour", "minute"};

    private TimeSinceFormatter() {
    }

    public static String format(OffsetDateTime from, OffsetDateTime now) {
        if (from == null || now == null) {
            return null;
        }
        long seconds = Duration.between(from, now).getSeconds();
        if (seconds < MINUTE) {
            return "0 minutes";
        }

        List<String> parts = new ArrayList<>(2);
        for (int i = 0; i < UNIT_SECONDS.length; i++) {
            long count = seconds / UNIT_SECONDS[i];
            if (count == 0) {
                continue;
            }
            parts.add(plural(count, UNIT_NAMES[i]));
            if (i + 1 < UNIT_SECONDS.length) {
                long next = (seconds - count * UNIT_SECONDS[i]) / UNIT_SECONDS[i + 1];
                if (next > 0) {
                    parts.add(plural(next, UNIT_NAMES[i + 1]));
                }
            }
            break;
        }
        return String.join(", ", parts);
    }

    private static String plural(long count, String unit) {
        return count + " " + unit + (count == 1 ? "" : "s");
    }
}
