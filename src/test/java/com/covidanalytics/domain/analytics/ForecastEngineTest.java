package com.covidanalytics.domain.analytics;

import com.covidanalytics.config.AnalyticsProperties;
import com.covidanalytics.domain.error.ForecastFailedException;
import com.covidanalytics.domain.error.InsufficientDataException;
import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ForecastResult;
import com.covidanalytics.domain.model.Interval;
import com.covidanalytics.domain.model.TimeSeriesPoint;
import com.covidanalytics.domain.model.TrendSeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ForecastEngineTest {

    private ForecastEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ForecastEngine(new AnalyticsProperties());
    }

    @Test
    void testForecast_LosAngelesDailyFourteenDays() {
        // Given: 120 daily cumulative case counts
        LocalDate start = LocalDate.of(2020, 4, 1);
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int t = 0; t < 120; t++) {
            points.add(new TimeSeriesPoint(start.plusDays(t), 5000 + 400.0 * t + 150 * Math.sin(t / 3.0)));
        }
        TrendSeries series = TrendSeries.of(Interval.DAY, points);

        // When
        ForecastResult result = engine.forecast(series, 14);

        // Then
        List<TimeSeriesPoint> forecast = result.getForecast().getPoints();
        assertEquals(14, forecast.size());
        assertEquals(14, result.getHorizon());
        assertEquals(series.lastPeriod().plusDays(1), forecast.get(0).getPeriod());
        for (int i = 1; i < forecast.size(); i++) {
            assertEquals(forecast.get(i - 1).getPeriod().plusDays(1), forecast.get(i).getPeriod());
        }
        for (TimeSeriesPoint point : forecast) {
            assertTrue(Double.isFinite(point.getValue()));
        }
        assertTrue(Math.abs(result.getAr()) < 1.0);
        assertTrue(Math.abs(result.getMa()) < 1.0);
        assertTrue(result.getResidualVariance() >= 0.0);
        assertSame(series, result.getObserved());
    }

    @Test
    void testForecast_MonthlySeriesStartsNextMonth() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int m = 0; m < 12; m++) {
            points.add(new TimeSeriesPoint(LocalDate.of(2021, 1, 1).plusMonths(m), 100.0 + 10 * m + (m % 3)));
        }
        TrendSeries series = TrendSeries.of(Interval.MONTH, points);

        ForecastResult result = engine.forecast(series, 3);

        List<TimeSeriesPoint> forecast = result.getForecast().getPoints();
        assertEquals(3, forecast.size());
        assertEquals(LocalDate.of(2022, 1, 1), forecast.get(0).getPeriod());
        assertEquals(LocalDate.of(2022, 2, 1), forecast.get(1).getPeriod());
        assertEquals(LocalDate.of(2022, 3, 1), forecast.get(2).getPeriod());
        assertEquals(Interval.MONTH, result.getForecast().getInterval());
    }

    @Test
    void testForecast_ConstantSeriesStaysFlat() {
        TrendSeries series = daily(7.0, 7.0, 7.0, 7.0, 7.0, 7.0);

        ForecastResult result = engine.forecast(series, 5);

        for (TimeSeriesPoint point : result.getForecast().getPoints()) {
            assertEquals(7.0, point.getValue(), 1e-9);
        }
    }

    @Test
    void testForecast_RecoversAutoregressiveCoefficient() {
        // Given: differences follow y_t = 0.6 y_{t-1} + e_t
        Random random = new Random(7);
        double[] levels = new double[400];
        double diff = 0.0;
        levels[0] = 1000.0;
        for (int t = 1; t < levels.length; t++) {
            diff = 0.6 * diff + random.nextGaussian();
            levels[t] = levels[t - 1] + diff;
        }

        // When
        ForecastResult result = engine.forecast(daily(levels), 10);

        // Then
        assertEquals(0.6, result.getAr(), 0.2);
    }

    @Test
    void testForecast_SameInputSameOutput() {
        TrendSeries series = daily(1, 3, 2, 5, 4, 8, 7, 9, 12, 11);

        ForecastResult first = engine.forecast(series, 4);
        ForecastResult second = engine.forecast(series, 4);

        assertEquals(first.getForecast(), second.getForecast());
        assertEquals(first.getAr(), second.getAr());
    }

    @Test
    void testForecast_TooFewObservations() {
        TrendSeries series = daily(1.0, 2.0, 3.0);

        assertThrows(InsufficientDataException.class, () -> engine.forecast(series, 14));
    }

    @Test
    void testForecast_EmptySeries() {
        TrendSeries series = TrendSeries.of(Interval.DAY, List.of());

        assertThrows(InsufficientDataException.class, () -> engine.forecast(series, 14));
    }

    @Test
    void testForecast_OverflowingSeriesFails() {
        TrendSeries series = daily(1e308, -1e308, 1e308, -1e308, 1e308, -1e308);

        assertThrows(ForecastFailedException.class, () -> engine.forecast(series, 14));
    }

    @Test
    void testForecast_HorizonMustBePositive() {
        TrendSeries series = daily(1, 2, 3, 4, 5);

        assertThrows(InvalidFilterException.class, () -> engine.forecast(series, 0));
    }

    @Test
    void testConditionalSumOfSquares_ZeroCoefficientsIsPlainSumOfSquares() {
        double[] y = {1.0, 2.0, -1.0, 3.0};

        // first residual is conditioned away
        assertEquals(4.0 + 1.0 + 9.0, ForecastEngine.conditionalSumOfSquares(y, 0.0, 0.0), 1e-12);
    }

    private static TrendSeries daily(double... values) {
        LocalDate start = LocalDate.of(2021, 1, 1);
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new TimeSeriesPoint(start.plusDays(i), values[i]));
        }
        return TrendSeries.of(Interval.DAY, points);
    }
}
