package com.covidanalytics.api;

import com.covidanalytics.domain.model.ClusteringResult;
import com.covidanalytics.domain.model.DateRange;
import com.covidanalytics.domain.model.ForecastResult;
import com.covidanalytics.domain.model.LookupResult;
import com.covidanalytics.domain.model.ResultRow;
import com.covidanalytics.domain.service.AggregationService;
import com.covidanalytics.domain.service.ClusterService;
import com.covidanalytics.domain.service.ForecastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only REST API over the warehouse views and the analytics pipelines.
 *
 * Endpoints:
 * - GET /api/v1/demographics - County demographics
 * - GET /api/v1/cases - Cases by county and date
 * - GET /api/v1/cases-demographics - Cases by demographic category
 * - GET /api/v1/hospitals - Hospitalizations by county
 * - GET /api/v1/cases-demographics-view - Cases joined with demographics
 * - GET /api/v1/summary/county - Top counties by a metric
 * - GET /api/v1/summary/trend - Metric trend by day or month
 * - GET /api/v1/analytics/forecast - ARIMA(1,1,1) forecast of a trend
 * - GET /api/v1/analytics/clusters - K-means grouping of counties
 *
 * Dates are ISO 8601 ({@code yyyy-MM-dd}). Lookups answer with a single
 * object when the filters pin down one record, otherwise with an array.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AggregationService aggregationService;
    private final ForecastService forecastService;
    private final ClusterService clusterService;

    @GetMapping("/demographics")
    public ResponseEntity<?> demographics(@RequestParam(required = false) String county) {
        log.info("Demographics: county={}", county);
        return respond(aggregationService.getEntitySummary(county));
    }

    @GetMapping("/cases")
    public ResponseEntity<?> cases(
            @RequestParam(required = false) String county,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("Cases: county={}, date={}", county, date);
        return respond(aggregationService.getCases(county, date));
    }

    @GetMapping("/cases-demographics")
    public ResponseEntity<?> casesDemographics(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("Cases demographics: category={}, date={}", category, date);
        return respond(aggregationService.getCasesByDemographic(category, date));
    }

    @GetMapping("/hospitals")
    public ResponseEntity<?> hospitals(
            @RequestParam(required = false) String county,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("Hospitals: county={}, date={}", county, date);
        return respond(aggregationService.getHospitalizations(county, date));
    }

    /**
     * GET /api/v1/cases-demographics-view?county=xxx&date=xxx&startDate=xxx&endDate=xxx
     *
     * Use either {@code date} or {@code startDate}/{@code endDate}, not both.
     */
    @GetMapping("/cases-demographics-view")
    public ResponseEntity<?> casesDemographicsView(
            @RequestParam(required = false) String county,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DateRange range = DateRange.ofNullable(startDate, endDate);
        return respond(aggregationService.getCrossSectionalView(county, date, range));
    }

    /**
     * GET /api/v1/summary/county?metric=cases_per_100k&limit=10&startDate=xxx&endDate=xxx
     */
    @GetMapping("/summary/county")
    public ResponseEntity<?> countySummary(
            @RequestParam(defaultValue = "cases_per_100k") String metric,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DateRange range = DateRange.ofNullable(startDate, endDate);
        return respond(aggregationService.getTopNByMetric(metric, range, limit));
    }

    /**
     * GET /api/v1/summary/trend?county=xxx&metric=xxx&interval=day|month
     *
     * Without a metric, every metric is returned per period.
     */
    @GetMapping("/summary/trend")
    public ResponseEntity<?> trend(
            @RequestParam(required = false) String county,
            @RequestParam(required = false) String metric,
            @RequestParam(defaultValue = "day") String interval) {
        return respond(aggregationService.getTrend(county, metric, interval));
    }

    /**
     * GET /api/v1/analytics/forecast?county=xxx&metric=cases&interval=day&horizon=14
     *
     * Response:
     * - observed: the trend the model was fitted on
     * - forecast: {@code horizon} points starting one period after the last observation
     * - ar, ma, residualVariance: fitted model parameters
     */
    @GetMapping("/analytics/forecast")
    public ResponseEntity<ForecastResult> forecast(
            @RequestParam(required = false) String county,
            @RequestParam String metric,
            @RequestParam(defaultValue = "day") String interval,
            @RequestParam(defaultValue = "14") int horizon) {
        return ResponseEntity.ok(forecastService.forecast(county, metric, interval, horizon));
    }

    /**
     * GET /api/v1/analytics/clusters?features=a,b&k=3&date=xxx
     *
     * Response:
     * - assignments: cluster index per county, in county-name order
     * - standardized: the z-scored feature values that were clustered
     * - withinClusterSumOfSquares: total squared distance to the centroids
     */
    @GetMapping("/analytics/clusters")
    public ResponseEntity<ClusteringResult> clusters(
            @RequestParam List<String> features,
            @RequestParam(defaultValue = "3") int k,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        DateRange range = DateRange.ofNullable(startDate, endDate);
        return ResponseEntity.ok(clusterService.cluster(features, k, date, range));
    }

    private static ResponseEntity<?> respond(LookupResult<ResultRow> result) {
        if (result instanceof LookupResult.Found<ResultRow> found) {
            return ResponseEntity.ok(found.getValue());
        }
        if (result instanceof LookupResult.FoundMany<ResultRow> many) {
            return ResponseEntity.ok(many.getValues());
        }
        LookupResult.NotFound<ResultRow> notFound = (LookupResult.NotFound<ResultRow>) result;
        throw notFound.toException();
    }
}
