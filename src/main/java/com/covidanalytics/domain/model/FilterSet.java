package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Declarative filters for a single warehouse query.
 *
 * An exact date and a date range are mutually exclusive: supplying both is
 * rejected rather than producing a query that only matches when the date
 * falls inside the range.
 */
@Value
@Builder(toBuilder = true)
public class FilterSet {

    String entity;
    LocalDate date;
    DateRange dateRange;
    DemographicCategory category;
    Metric metric;

    @Builder.Default
    Interval interval = Interval.DAY;

    public static FilterSet empty() {
        return FilterSet.builder().build();
    }

    public boolean hasEntity() {
        return entity != null && !entity.isBlank();
    }

    public FilterSet validate() {
        if (date != null && dateRange != null) {
            throw new InvalidFilterException("Supply either an exact date or a date range, not both");
        }
        if (entity != null && entity.isBlank()) {
            throw new InvalidFilterException("Entity filter must not be blank");
        }
        return this;
    }
}
