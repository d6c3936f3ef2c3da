package org.prevoccupai.oh.data.query;

import org.prevoccupai.oh.exception.ExtractionConfigurationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Inclusive calendar date range.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new ExtractionConfigurationException("Date range needs both a start and an end");
        }
        if (start.isAfter(end)) {
            throw new ExtractionConfigurationException("Date range start " + start + " is after its end " + end);
        }
    }

    /**
     * @param start ISO date, YYYY-MM-DD
     * @param end ISO date, YYYY-MM-DD
     */
    public static DateRange of(String start, String end) {
        return new DateRange(parseBound(start), parseBound(end));
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    private static LocalDate parseBound(String bound) {
        if (bound == null) {
            throw new ExtractionConfigurationException("Date range bound is missing");
        }
        try {
            return LocalDate.parse(bound);
        } catch (DateTimeParseException e) {
            throw new ExtractionConfigurationException("Date range bound '" + bound + "' is not a YYYY-MM-DD date", e);
        }
    }
}
