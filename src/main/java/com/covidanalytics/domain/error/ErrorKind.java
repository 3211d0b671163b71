package com.covidanalytics.domain.error;

/**
 * Failure categories surfaced to callers.
 */
public enum ErrorKind {
    INVALID_FILTER,
    NOT_FOUND,
    UPSTREAM_UNAVAILABLE,
    INSUFFICIENT_DATA,
    FORECAST_FAILED,
    CLUSTERING_FAILED,
    INTERNAL
}
