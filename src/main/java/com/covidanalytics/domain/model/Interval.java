package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;

import java.time.LocalDate;

/**
 * Grouping interval of a trend series.
 */
public enum Interval {
    DAY("day") {
        @Override
        public LocalDate normalize(LocalDate date) {
            return date;
        }

        @Override
        public LocalDate next(LocalDate period) {
            return period.plusDays(1);
        }
    },
    MONTH("month") {
        @Override
        public LocalDate normalize(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate next(LocalDate period) {
            return period.withDayOfMonth(1).plusMonths(1);
        }
    };

    private final String apiName;

    Interval(String apiName) {
        this.apiName = apiName;
    }

    public String getApiName() {
        return apiName;
    }

    /** Truncates a date to the start of its bucket. */
    public abstract LocalDate normalize(LocalDate date);

    /** First period after {@code period}. */
    public abstract LocalDate next(LocalDate period);

    public static Interval fromName(String name) {
        if (name == null || name.isBlank()) {
            return DAY;
        }
        for (Interval interval : values()) {
            if (interval.apiName.equalsIgnoreCase(name.trim())) {
                return interval;
            }
        }
        throw new InvalidFilterException("Invalid interval '" + name + "'. Choose from [day, month]");
    }
}
