package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.infrastructure.query.AggregateFunction;
import com.covidanalytics.infrastructure.query.Column;
import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Case and death metrics that can be trended, ranked or forecast.
 *
 * Absolute counts are summed across rows in a bucket; per-capita rates are averaged.
 */
@Getter
public enum Metric {
    CASES("cases", Column.TOTAL_CASES, AggregateFunction.SUM),
    DEATHS("deaths", Column.TOTAL_DEATHS, AggregateFunction.SUM),
    CASES_PER_100K("cases_per_100k", Column.CASES_PER_100K, AggregateFunction.AVG),
    DEATHS_PER_100K("deaths_per_100k", Column.DEATHS_PER_100K, AggregateFunction.AVG);

    private final String apiName;
    private final Column column;
    private final AggregateFunction bucketAggregate;

    Metric(String apiName, Column column, AggregateFunction bucketAggregate) {
        this.apiName = apiName;
        this.column = column;
        this.bucketAggregate = bucketAggregate;
    }

    public static Metric fromName(String name) {
        if (name != null) {
            for (Metric metric : values()) {
                if (metric.apiName.equalsIgnoreCase(name.trim())) {
                    return metric;
                }
            }
        }
        throw new InvalidFilterException("Invalid metric '" + name + "'. Choose from " + allowedNames());
    }

    static String allowedNames() {
        return Arrays.stream(values()).map(Metric::getApiName).collect(Collectors.joining(", ", "[", "]"));
    }
}
