package com.covidanalytics.domain.service;

import com.covidanalytics.config.AnalyticsProperties;
import com.covidanalytics.domain.analytics.ClusterEngine;
import com.covidanalytics.domain.error.InsufficientDataException;
import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ClusterFeature;
import com.covidanalytics.domain.model.ClusteringResult;
import com.covidanalytics.domain.model.DateRange;
import com.covidanalytics.domain.model.FeatureTable;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Groups counties by their averaged features over a date or date range.
 *
 * Feature names and k are checked before the warehouse is queried. The seed
 * comes from {@code analytics.cluster.seed}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClusterService {

    private final AggregationService aggregationService;
    private final ClusterEngine clusterEngine;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;

    public ClusteringResult cluster(List<String> featureNames, int k, LocalDate date, DateRange range) {
        List<ClusterFeature> features = parseFeatures(featureNames);
        if (features.size() < ClusterEngine.MIN_FEATURES) {
            throw new InsufficientDataException("Select at least " + ClusterEngine.MIN_FEATURES
                    + " distinct features for clustering, got " + features.size());
        }
        int maxClusters = properties.getCluster().getMaxClusters();
        if (k < 2 || k > maxClusters) {
            throw new InvalidFilterException("Number of clusters must be between 2 and " + maxClusters + ", got " + k);
        }

        log.info("Cluster request: features={}, k={}, date={}, range={}", features, k, date, range);

        FeatureTable table = aggregationService.getFeatureTable(features, date, range);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return clusterEngine.cluster(table, k, properties.getCluster().getSeed());
        } finally {
            sample.stop(Timer.builder("analytics.run")
                    .tag("type", "clusters")
                    .register(meterRegistry));
        }
    }

    private static List<ClusterFeature> parseFeatures(List<String> names) {
        Set<ClusterFeature> features = new LinkedHashSet<>();
        if (names != null) {
            for (String name : names) {
                if (name != null && !name.isBlank()) {
                    features.add(ClusterFeature.fromName(name));
                }
            }
        }
        return new ArrayList<>(features);
    }
}
