package com.covidanalytics.domain.error;

/**
 * The warehouse could not be reached or did not answer in time.
 */
public class UpstreamUnavailableException extends AnalyticsException {

    public UpstreamUnavailableException(String message) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }
}
