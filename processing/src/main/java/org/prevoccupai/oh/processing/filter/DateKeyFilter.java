package org.prevoccupai.oh.processing.filter;

import org.prevoccupai.oh.data.profile.ProfileDates;
import org.prevoccupai.oh.data.query.DateRange;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Restricts date keys to a date range. Keys that are not dates (e.g. {@code EMG_weekly_metrics}) always pass.
 */
public class DateKeyFilter {

    private DateKeyFilter() {
    }

    public static List<String> filter(List<String> keys, DateRange range) {
        if (range == null) {
            return keys;
        }
        return keys.stream().filter(key -> accepts(key, range)).collect(Collectors.toList());
    }

    public static boolean accepts(String key, DateRange range) {
        return range == null || ProfileDates.parseDate(key).map(range::contains).orElse(true);
    }
}
