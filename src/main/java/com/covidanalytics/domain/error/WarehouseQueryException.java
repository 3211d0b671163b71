package com.covidanalytics.domain.error;

/**
 * The warehouse answered but rejected the statement (bad SQL, missing
 * object, constraint). Not a connectivity problem, so it is reported as an
 * internal failure and does not count against the warehouse circuit breaker.
 */
public class WarehouseQueryException extends AnalyticsException {

    public WarehouseQueryException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
