package com.covidanalytics.domain.service;

import com.covidanalytics.config.AnalyticsProperties;
import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ClusterFeature;
import com.covidanalytics.domain.model.DateRange;
import com.covidanalytics.domain.model.DemographicCategory;
import com.covidanalytics.domain.model.FeatureTable;
import com.covidanalytics.domain.model.FilterSet;
import com.covidanalytics.domain.model.Interval;
import com.covidanalytics.domain.model.LookupResult;
import com.covidanalytics.domain.model.Metric;
import com.covidanalytics.domain.model.ResultRow;
import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.domain.model.TrendSeries;
import com.covidanalytics.infrastructure.cache.ResultCache;
import com.covidanalytics.infrastructure.query.AggregateFunction;
import com.covidanalytics.infrastructure.query.Column;
import com.covidanalytics.infrastructure.query.QueryBuilder;
import com.covidanalytics.infrastructure.query.QuerySignature;
import com.covidanalytics.infrastructure.query.SortDirection;
import com.covidanalytics.infrastructure.query.WarehouseTable;
import com.covidanalytics.infrastructure.warehouse.EntityDirectory;
import com.covidanalytics.infrastructure.warehouse.WarehouseClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * Typed query operations over the warehouse views.
 *
 * Query Flow:
 * 1. Parse and validate filters (enumerations, county directory, date rules)
 * 2. Build the parameterized query and its signature
 * 3. Serve from the result cache, or execute on the warehouse on a miss
 * 4. Shape the rows for the caller
 *
 * Validation failures are raised in step 1, before the cache or the
 * warehouse is touched. Warehouse failures surface as
 * UpstreamUnavailableException and are never cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final WarehouseClient warehouseClient;
    private final ResultCache resultCache;
    private final EntityDirectory entityDirectory;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * Demographics for one county, or for every county when none is given.
     */
    public LookupResult<ResultRow> getEntitySummary(String entity) {
        FilterSet filters = entityFilters(entity).build().validate();
        requireKnownEntity(filters);

        QuerySignature signature = QueryBuilder.from(WarehouseTable.COUNTY_DEMOGRAPHICS)
                .selectAll()
                .where(filters)
                .orderBy(Column.COUNTY_NAME, SortDirection.ASC)
                .build();

        ResultTable table = run("demographics", signature);
        return shape(table, filters.hasEntity(), "No demographics found");
    }

    /**
     * Bucketed trend rows: {@code PERIOD} plus one column per metric.
     * Without a metric all four metrics are returned.
     */
    public LookupResult<ResultRow> getTrend(String entity, String metric, String interval) {
        Metric parsedMetric = metric == null || metric.isBlank() ? null : Metric.fromName(metric);
        ResultTable table = trendTable(entity, parsedMetric, Interval.fromName(interval));
        return shape(table, false, "No trend data found");
    }

    /**
     * Single-metric trend as a clean series, for forecasting.
     */
    public TrendSeries getTrendSeries(String entity, Metric metric, Interval interval) {
        if (metric == null) {
            throw new InvalidFilterException("A metric is required for a trend series");
        }
        ResultTable table = trendTable(entity, metric, interval);
        return TrendSeries.fromRows(table, metric.getColumn(), interval);
    }

    /**
     * Case/death metrics joined with demographic ratios, one row per county and date.
     *
     * An exact date and a date range cannot be combined. A single record is
     * returned when a county is given with an exact date or a one-day range.
     */
    public LookupResult<ResultRow> getCrossSectionalView(String entity, LocalDate date, DateRange range) {
        FilterSet filters = entityFilters(entity)
                .date(date)
                .dateRange(range)
                .build()
                .validate();
        requireKnownEntity(filters);

        log.info("Cross-sectional view: county={}, date={}, range={}", entity, date, range);

        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS_VIEW)
                .selectAll()
                .where(filters)
                .orderBy(Column.AREA, SortDirection.ASC)
                .orderBy(Column.DATE, SortDirection.ASC)
                .build();

        ResultTable table = run("cross_section", signature);
        boolean single = filters.hasEntity() && (date != null || (range != null && range.isSingleDay()));
        return shape(table, single, "No data found with given filters");
    }

    /**
     * Counties ranked by the average of a metric, highest first.
     */
    public LookupResult<ResultRow> getTopNByMetric(String metric, DateRange range, int limit) {
        Metric parsedMetric = Metric.fromName(metric);
        int maxLimit = properties.getQuery().getMaxLimit();
        if (limit < 1 || limit > maxLimit) {
            throw new InvalidFilterException("Limit must be between 1 and " + maxLimit + ", got " + limit);
        }
        FilterSet filters = FilterSet.builder().dateRange(range).build().validate();

        log.info("Top {} counties by {}: range={}", limit, parsedMetric.getApiName(), range);

        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS_AGG)
                .select(Column.AREA)
                .selectAggregate(AggregateFunction.AVG, parsedMetric.getColumn())
                .where(filters)
                .groupBy(Column.AREA)
                .orderBy(AggregateFunction.AVG, parsedMetric.getColumn(), SortDirection.DESC)
                .limit(limit)
                .build();

        ResultTable table = run("top_n", signature);
        return shape(table, false, "No summary data found");
    }

    /**
     * Per-county averages of the selected features over a date or range,
     * as the cross-sectional input for clustering.
     */
    public FeatureTable getFeatureTable(List<ClusterFeature> features, LocalDate date, DateRange range) {
        if (features == null || features.isEmpty()) {
            throw new InvalidFilterException("At least one feature must be selected");
        }
        FilterSet filters = FilterSet.builder().date(date).dateRange(range).build().validate();

        QueryBuilder query = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS_VIEW)
                .select(Column.AREA);
        for (ClusterFeature feature : features) {
            query.selectAggregate(AggregateFunction.AVG, feature.getColumn());
        }
        QuerySignature signature = query
                .where(filters)
                .groupBy(Column.AREA)
                .orderBy(Column.AREA, SortDirection.ASC)
                .build();

        ResultTable table = run("features", signature);
        return FeatureTable.fromRows(table, Column.AREA, features);
    }

    public LookupResult<ResultRow> getCases(String entity, LocalDate date) {
        FilterSet filters = entityFilters(entity).date(date).build().validate();
        requireKnownEntity(filters);

        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES)
                .selectAll()
                .where(filters)
                .orderBy(Column.AREA, SortDirection.ASC)
                .orderBy(Column.DATE, SortDirection.ASC)
                .build();

        ResultTable table = run("cases", signature);
        return shape(table, filters.hasEntity() && date != null, "No cases found");
    }

    public LookupResult<ResultRow> getCasesByDemographic(String category, LocalDate date) {
        DemographicCategory parsed = category == null || category.isBlank()
                ? null
                : DemographicCategory.fromName(category);
        FilterSet filters = FilterSet.builder().category(parsed).date(date).build().validate();

        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS)
                .selectAll()
                .where(filters)
                .orderBy(Column.DEMOGRAPHIC_CATEGORY, SortDirection.ASC)
                .orderBy(Column.REPORT_DATE, SortDirection.ASC)
                .build();

        ResultTable table = run("cases_demographics", signature);
        return shape(table, parsed != null && date != null, "No cases demographics found");
    }

    public LookupResult<ResultRow> getHospitalizations(String entity, LocalDate date) {
        FilterSet filters = entityFilters(entity).date(date).build().validate();
        requireKnownEntity(filters);

        QuerySignature signature = QueryBuilder.from(WarehouseTable.HOSPITALS)
                .selectAll()
                .where(filters)
                .orderBy(Column.COUNTY, SortDirection.ASC)
                .orderBy(Column.TODAYS_DATE, SortDirection.ASC)
                .build();

        ResultTable table = run("hospitals", signature);
        return shape(table, filters.hasEntity() && date != null, "No hospital data found");
    }

    private ResultTable trendTable(String entity, Metric metric, Interval interval) {
        FilterSet filters = entityFilters(entity).metric(metric).interval(interval).build().validate();
        requireKnownEntity(filters);

        log.info("Trend query: county={}, metric={}, interval={}",
                entity, metric == null ? "all" : metric.getApiName(), interval.getApiName());

        QueryBuilder query = QueryBuilder.from(WarehouseTable.TREND).selectPeriod(interval);
        if (metric != null) {
            query.selectAggregate(metric.getBucketAggregate(), metric.getColumn());
        } else {
            for (Metric m : Metric.values()) {
                query.selectAggregate(m.getBucketAggregate(), m.getColumn());
            }
        }
        QuerySignature signature = query
                .where(filters)
                .groupByPeriod(interval)
                .orderBy(Column.PERIOD, SortDirection.ASC)
                .build();

        return run("trend", signature);
    }

    private ResultTable run(String type, QuerySignature signature) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return resultCache.getOrCompute(signature, () -> warehouseClient.execute(signature));
        } finally {
            sample.stop(Timer.builder("query.latency")
                    .tag("type", type)
                    .register(meterRegistry));
        }
    }

    private void requireKnownEntity(FilterSet filters) {
        if (filters.hasEntity()) {
            entityDirectory.requireKnown(filters.getEntity());
        }
    }

    private static FilterSet.FilterSetBuilder entityFilters(String entity) {
        return FilterSet.builder().entity(entity);
    }

    private static LookupResult<ResultRow> shape(ResultTable table, boolean single, String notFound) {
        if (table.isEmpty()) {
            return LookupResult.notFound(notFound);
        }
        if (single) {
            if (table.size() > 1) {
                log.warn("Expected one row but found {}; returning the first", table.size());
            }
            return LookupResult.found(table.first());
        }
        return LookupResult.foundMany(table.getRows());
    }
}
