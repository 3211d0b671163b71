package com.covidanalytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Cluster labels per entity plus the standardized feature values they were computed from.
 */
@Value
@Builder
public class ClusteringResult {
    int k;
    long seed;
    List<ClusterFeature> features;
    List<ClusterAssignment> assignments;
    List<FeatureVector> standardized;
    double withinClusterSumOfSquares;
}
