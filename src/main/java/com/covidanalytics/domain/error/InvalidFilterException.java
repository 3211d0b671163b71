package com.covidanalytics.domain.error;

/**
 * A caller-supplied value is outside its enumeration, or mutually exclusive filters were combined.
 */
public class InvalidFilterException extends AnalyticsException {

    public InvalidFilterException(String message) {
        super(ErrorKind.INVALID_FILTER, message);
    }

    public InvalidFilterException(String message, Throwable cause) {
        super(ErrorKind.INVALID_FILTER, message, cause);
    }
}
