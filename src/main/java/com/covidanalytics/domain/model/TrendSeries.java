package com.covidanalytics.domain.model;

import com.covidanalytics.infrastructure.query.Column;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Chronological series of bucketed metric values.
 *
 * Periods are strictly increasing; building a series sorts the points and
 * keeps only the first point seen for each period.
 */
@Slf4j
@Value
public class TrendSeries {

    Interval interval;
    List<TimeSeriesPoint> points;

    private TrendSeries(Interval interval, List<TimeSeriesPoint> points) {
        this.interval = interval;
        this.points = points;
    }

    public static TrendSeries of(Interval interval, List<TimeSeriesPoint> points) {
        List<TimeSeriesPoint> sorted = new ArrayList<>(points.size());
        for (TimeSeriesPoint p : points) {
            sorted.add(new TimeSeriesPoint(interval.normalize(p.getPeriod()), p.getValue()));
        }
        sorted.sort(Comparator.comparing(TimeSeriesPoint::getPeriod));

        List<TimeSeriesPoint> unique = new ArrayList<>(sorted.size());
        for (TimeSeriesPoint p : sorted) {
            if (!unique.isEmpty() && unique.get(unique.size() - 1).getPeriod().equals(p.getPeriod())) {
                continue;
            }
            unique.add(p);
        }
        if (unique.size() < sorted.size()) {
            log.warn("Dropped {} duplicate periods from trend series", sorted.size() - unique.size());
        }
        return new TrendSeries(interval, List.copyOf(unique));
    }

    /**
     * Reads the {@code PERIOD} column and the given value column, dropping rows
     * whose period or value is null or unparseable.
     */
    public static TrendSeries fromRows(ResultTable table, Column valueColumn, Interval interval) {
        List<TimeSeriesPoint> points = new ArrayList<>(table.size());
        int dropped = 0;
        for (ResultRow row : table.getRows()) {
            Optional<LocalDate> period = Scalars.toDate(row.get(Column.PERIOD));
            OptionalDouble value = Scalars.toDouble(row.get(valueColumn));
            if (period.isEmpty() || value.isEmpty()) {
                dropped++;
                continue;
            }
            points.add(new TimeSeriesPoint(period.get(), value.getAsDouble()));
        }
        if (dropped > 0) {
            log.warn("Dropped {} trend rows with missing {} or {}", dropped, Column.PERIOD, valueColumn);
        }
        return of(interval, points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public LocalDate lastPeriod() {
        return points.get(points.size() - 1).getPeriod();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }
}
