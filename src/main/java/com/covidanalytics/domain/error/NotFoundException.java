package com.covidanalytics.domain.error;

/**
 * A well-formed query matched zero rows.
 */
public class NotFoundException extends AnalyticsException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
