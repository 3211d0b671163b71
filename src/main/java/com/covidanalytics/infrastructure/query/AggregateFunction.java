package com.covidanalytics.infrastructure.query;

public enum AggregateFunction {
    SUM,
    AVG;

    String apply(Column column) {
        return name() + "(" + column.sql() + ")";
    }
}
