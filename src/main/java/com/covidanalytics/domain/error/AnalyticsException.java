package com.covidanalytics.domain.error;

/**
 * Base type for every failure this service reports.
 *
 * Each subclass fixes its {@link ErrorKind}; the message is the short cause
 * string shown to the caller.
 */
public abstract class AnalyticsException extends RuntimeException {

    private final ErrorKind kind;

    protected AnalyticsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalyticsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
