package org.prevoccupai.oh.data.profile;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Parsing of the date and time keys found in profiles. Sensor dates are keyed {@code DD-MM-YYYY} and sessions
 * {@code HH-MM-SS}; questionnaires use ISO dates, and slash-separated variants also occur.
 */
public class ProfileDates {

    public static final DateTimeFormatter DAY_MONTH_YEAR = strict("dd-MM-uuuu");
    public static final DateTimeFormatter SESSION_TIME = strict("HH-mm-ss");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DAY_MONTH_YEAR,
        strict("uuuu-MM-dd"),
        strict("dd/MM/uuuu"),
        strict("uuuu/MM/dd")
    );

    private ProfileDates() {
    }

    /**
     * Tries every known date key format in turn.
     */
    public static Optional<LocalDate> parseDate(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(key, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    public static Optional<LocalDate> parseDayMonthYear(String key) {
        return key == null ? Optional.empty() : tryParse(key, DAY_MONTH_YEAR);
    }

    public static Optional<LocalTime> parseSessionTime(String key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalTime.parse(key, SESSION_TIME));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isDateKey(String key) {
        return parseDate(key).isPresent();
    }

    public static boolean isTimeKey(String key) {
        return parseSessionTime(key).isPresent();
    }

    private static Optional<LocalDate> tryParse(String key, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(key, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
