package com.covidanalytics.domain.error;

/**
 * Not enough clean rows to fit a model.
 */
public class InsufficientDataException extends AnalyticsException {

    public InsufficientDataException(String message) {
        super(ErrorKind.INSUFFICIENT_DATA, message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(ErrorKind.INSUFFICIENT_DATA, message, cause);
    }
}
