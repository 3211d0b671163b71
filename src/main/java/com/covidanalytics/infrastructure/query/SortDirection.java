package com.covidanalytics.infrastructure.query;

public enum SortDirection {
    ASC,
    DESC
}
