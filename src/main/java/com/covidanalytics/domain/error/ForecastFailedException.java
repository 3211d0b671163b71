package com.covidanalytics.domain.error;

/**
 * The ARIMA fit or forecast did not produce usable numbers.
 */
public class ForecastFailedException extends AnalyticsException {

    public ForecastFailedException(String message) {
        super(ErrorKind.FORECAST_FAILED, message);
    }

    public ForecastFailedException(String message, Throwable cause) {
        super(ErrorKind.FORECAST_FAILED, message, cause);
    }
}
