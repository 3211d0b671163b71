package com.covidanalytics.domain.service;

import com.covidanalytics.config.AnalyticsProperties;
import com.covidanalytics.domain.analytics.ForecastEngine;
import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ForecastResult;
import com.covidanalytics.domain.model.Interval;
import com.covidanalytics.domain.model.Metric;
import com.covidanalytics.domain.model.TrendSeries;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Trend series for a county and metric, continued with an ARIMA(1,1,1) forecast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final AggregationService aggregationService;
    private final ForecastEngine forecastEngine;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;

    public ForecastResult forecast(String entity, String metric, String interval, int horizon) {
        Metric parsedMetric = Metric.fromName(metric);
        Interval parsedInterval = Interval.fromName(interval);
        int maxHorizon = properties.getForecast().getMaxHorizon();
        if (horizon < 1 || horizon > maxHorizon) {
            throw new InvalidFilterException("Horizon must be between 1 and " + maxHorizon + ", got " + horizon);
        }

        log.info("Forecast request: county={}, metric={}, interval={}, horizon={}",
                entity, parsedMetric.getApiName(), parsedInterval.getApiName(), horizon);

        TrendSeries series = aggregationService.getTrendSeries(entity, parsedMetric, parsedInterval);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return forecastEngine.forecast(series, horizon).toBuilder()
                    .entity(entity)
                    .metric(parsedMetric)
                    .build();
        } finally {
            sample.stop(Timer.builder("analytics.run")
                    .tag("type", "forecast")
                    .register(meterRegistry));
        }
    }
}
