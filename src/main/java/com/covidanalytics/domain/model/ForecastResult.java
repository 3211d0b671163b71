package com.covidanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Observed series and its forecast continuation. The forecast starts one
 * period after the last observed period and has exactly {@code horizon} points.
 */
@Value
@Builder(toBuilder = true)
public class ForecastResult {
    String entity;
    Metric metric;
    TrendSeries observed;
    TrendSeries forecast;
    int horizon;

    // fitted ARIMA(1,1,1) coefficients
    double ar;
    double ma;
    double residualVariance;
}
