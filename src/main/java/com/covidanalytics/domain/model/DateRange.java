package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;
import lombok.Value;

import java.time.LocalDate;

/**
 * Inclusive date range. Either bound may be open, but not both.
 */
@Value
public class DateRange {

    LocalDate start;
    LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null && end == null) {
            throw new InvalidFilterException("Date range needs a start date, an end date, or both");
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidFilterException("Date range start " + start + " is after end " + end);
        }
        return new DateRange(start, end);
    }

    /**
     * Null when both bounds are absent, which request parameters allow.
     */
    public static DateRange ofNullable(LocalDate start, LocalDate end) {
        if (start == null && end == null) {
            return null;
        }
        return of(start, end);
    }

    public boolean isSingleDay() {
        return start != null && start.equals(end);
    }
}
