package com.covidanalytics.domain.analytics;

import com.covidanalytics.config.AnalyticsProperties;
import com.covidanalytics.domain.error.ForecastFailedException;
import com.covidanalytics.domain.error.InsufficientDataException;
import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ForecastResult;
import com.covidanalytics.domain.model.Interval;
import com.covidanalytics.domain.model.TimeSeriesPoint;
import com.covidanalytics.domain.model.TrendSeries;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * ARIMA(1,1,1) forecaster.
 *
 * Model:
 * - First differences y_t = x_t - x_{t-1}
 * - y_t = phi * y_{t-1} + e_t + theta * e_{t-1}, no constant term
 * - phi and theta fitted by conditional sum of squares (e_0 = 0),
 *   searched with Nelder-Mead over tanh(u), tanh(v) so both stay in (-1, 1)
 *
 * Forecasts iterate the differenced model forward from the last residual
 * and integrate back onto the last observed level.
 */
@Slf4j
@Component
public class ForecastEngine {

    /** p + d + q + 1 */
    public static final int MIN_OBSERVATIONS = 4;

    private static final double RELATIVE_TOLERANCE = 1e-10;
    private static final double ABSOLUTE_TOLERANCE = 1e-14;

    private final int maxEvaluations;

    public ForecastEngine(AnalyticsProperties properties) {
        this.maxEvaluations = properties.getForecast().getMaxEvaluations();
    }

    public ForecastResult forecast(TrendSeries series, int horizon) {
        if (horizon < 1) {
            throw new InvalidFilterException("Forecast horizon must be at least 1, got " + horizon);
        }
        if (series.size() < MIN_OBSERVATIONS) {
            throw new InsufficientDataException("ARIMA(1,1,1) needs at least " + MIN_OBSERVATIONS
                    + " observations, got " + series.size());
        }

        long start = System.currentTimeMillis();
        double[] levels = series.values();
        double[] diffs = difference(levels);

        Fit fit = fit(diffs);

        List<TimeSeriesPoint> points = new ArrayList<>(horizon);
        Interval interval = series.getInterval();
        LocalDate period = series.lastPeriod();
        double level = levels[levels.length - 1];
        double step = fit.phi * diffs[diffs.length - 1] + fit.theta * fit.lastResidual;
        for (int h = 0; h < horizon; h++) {
            level += step;
            if (!Double.isFinite(level)) {
                throw new ForecastFailedException("Forecast diverged at step " + (h + 1));
            }
            period = interval.next(period);
            points.add(new TimeSeriesPoint(period, level));
            step = fit.phi * step;
        }

        log.info("ARIMA(1,1,1) fitted on {} points in {}ms: phi={}, theta={}, sigma2={}",
                levels.length, System.currentTimeMillis() - start, fit.phi, fit.theta, fit.residualVariance);

        return ForecastResult.builder()
                .observed(series)
                .forecast(TrendSeries.of(interval, points))
                .horizon(horizon)
                .ar(fit.phi)
                .ma(fit.theta)
                .residualVariance(fit.residualVariance)
                .build();
    }

    private static double[] difference(double[] levels) {
        double[] diffs = new double[levels.length - 1];
        for (int i = 1; i < levels.length; i++) {
            diffs[i - 1] = levels[i] - levels[i - 1];
            if (!Double.isFinite(diffs[i - 1])) {
                throw new ForecastFailedException("Differenced series is not finite at position " + i);
            }
        }
        return diffs;
    }

    private Fit fit(double[] diffs) {
        SimplexOptimizer optimizer = new SimplexOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
        PointValuePair optimum;
        try {
            optimum = optimizer.optimize(
                    new MaxEval(maxEvaluations),
                    new ObjectiveFunction(u -> conditionalSumOfSquares(diffs, Math.tanh(u[0]), Math.tanh(u[1]))),
                    GoalType.MINIMIZE,
                    new InitialGuess(new double[]{0.0, 0.0}),
                    new NelderMeadSimplex(2, 0.5));
        } catch (TooManyEvaluationsException e) {
            throw new ForecastFailedException("ARIMA fit did not converge within "
                    + maxEvaluations + " evaluations", e);
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            throw new ForecastFailedException("ARIMA fit failed: " + e.getMessage(), e);
        }

        double phi = Math.tanh(optimum.getPoint()[0]);
        double theta = Math.tanh(optimum.getPoint()[1]);
        double sse = conditionalSumOfSquares(diffs, phi, theta);
        if (!Double.isFinite(sse)) {
            throw new ForecastFailedException("ARIMA fit produced a non-finite sum of squares");
        }
        log.debug("Optimizer finished after {} evaluations", optimizer.getEvaluations());
        return new Fit(phi, theta, lastResidual(diffs, phi, theta), sse / (diffs.length - 1));
    }

    static double conditionalSumOfSquares(double[] y, double phi, double theta) {
        double previous = 0.0;
        double sse = 0.0;
        for (int t = 1; t < y.length; t++) {
            double residual = y[t] - phi * y[t - 1] - theta * previous;
            sse += residual * residual;
            previous = residual;
        }
        return sse;
    }

    private static double lastResidual(double[] y, double phi, double theta) {
        double previous = 0.0;
        for (int t = 1; t < y.length; t++) {
            previous = y[t] - phi * y[t - 1] - theta * previous;
        }
        return previous;
    }

    private static final class Fit {
        final double phi;
        final double theta;
        final double lastResidual;
        final double residualVariance;

        Fit(double phi, double theta, double lastResidual, double residualVariance) {
            this.phi = phi;
            this.theta = theta;
            this.lastResidual = lastResidual;
            this.residualVariance = residualVariance;
        }
    }
}
