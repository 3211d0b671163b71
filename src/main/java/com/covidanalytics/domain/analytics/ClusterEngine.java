package com.covidanalytics.domain.analytics;

import com.covidanalytics.config.AnalyticsProperties;
import com.covidanalytics.domain.error.ClusteringFailedException;
import com.covidanalytics.domain.error.InsufficientDataException;
import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ClusterAssignment;
import com.covidanalytics.domain.model.ClusterFeature;
import com.covidanalytics.domain.model.ClusteringResult;
import com.covidanalytics.domain.model.FeatureTable;
import com.covidanalytics.domain.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * K-means clustering of entities on standardized features.
 *
 * Each feature is centered on its mean and divided by its population
 * standard deviation. Centroids are seeded with k-means++ from a
 * {@link JDKRandomGenerator} with the caller's seed; entities are always fed
 * in name order, so the same table and seed give the same labels.
 */
@Slf4j
@Component
public class ClusterEngine {

    public static final int MIN_FEATURES = 2;

    static final double MIN_STD = 1e-12;

    private final int maxIterations;

    public ClusterEngine(AnalyticsProperties properties) {
        this.maxIterations = properties.getCluster().getMaxIterations();
    }

    public ClusteringResult cluster(FeatureTable table, int k, long seed) {
        if (k < 2) {
            throw new InvalidFilterException("Number of clusters must be at least 2, got " + k);
        }
        List<ClusterFeature> features = table.getFeatures();
        if (features.size() < MIN_FEATURES) {
            throw new InsufficientDataException("Clustering needs at least " + MIN_FEATURES
                    + " features, got " + features.size());
        }
        if (table.size() < k) {
            throw new InsufficientDataException("Clustering into " + k + " groups needs at least "
                    + k + " complete counties, got " + table.size());
        }

        long start = System.currentTimeMillis();
        List<EntityPoint> points = standardize(table);

        JDKRandomGenerator random = new JDKRandomGenerator();
        random.setSeed(seed);
        KMeansPlusPlusClusterer<EntityPoint> clusterer = new KMeansPlusPlusClusterer<>(
                k, maxIterations, new EuclideanDistance(), random,
                KMeansPlusPlusClusterer.EmptyClusterStrategy.ERROR);

        List<CentroidCluster<EntityPoint>> clusters;
        try {
            clusters = clusterer.cluster(points);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ClusteringFailedException("K-means failed: " + e.getMessage(), e);
        }
        if (clusters.size() != k) {
            throw new ClusteringFailedException("K-means produced " + clusters.size() + " clusters, expected " + k);
        }

        Map<EntityPoint, Integer> labels = new IdentityHashMap<>();
        double sse = 0.0;
        EuclideanDistance distance = new EuclideanDistance();
        for (int index = 0; index < clusters.size(); index++) {
            CentroidCluster<EntityPoint> cluster = clusters.get(index);
            if (cluster.getPoints().isEmpty()) {
                throw new ClusteringFailedException("Cluster " + index + " is empty");
            }
            double[] center = cluster.getCenter().getPoint();
            for (EntityPoint point : cluster.getPoints()) {
                labels.put(point, index);
                double d = distance.compute(point.getPoint(), center);
                sse += d * d;
            }
        }

        List<ClusterAssignment> assignments = new ArrayList<>(points.size());
        List<FeatureVector> standardized = new ArrayList<>(points.size());
        for (EntityPoint point : points) {
            assignments.add(new ClusterAssignment(point.vector.getEntity(), labels.get(point)));
            standardized.add(point.vector);
        }

        log.info("Clustered {} counties into {} groups on {} in {}ms (seed={}, sse={})",
                points.size(), k, features, System.currentTimeMillis() - start, seed, sse);

        return ClusteringResult.builder()
                .k(k)
                .seed(seed)
                .features(features)
                .assignments(List.copyOf(assignments))
                .standardized(List.copyOf(standardized))
                .withinClusterSumOfSquares(sse)
                .build();
    }

    private static List<EntityPoint> standardize(FeatureTable table) {
        List<ClusterFeature> features = table.getFeatures();
        List<FeatureVector> vectors = table.getVectors();
        double[] means = new double[features.size()];
        double[] stds = new double[features.size()];

        StandardDeviation population = new StandardDeviation(false);
        Mean mean = new Mean();
        for (int f = 0; f < features.size(); f++) {
            double[] column = new double[vectors.size()];
            for (int i = 0; i < vectors.size(); i++) {
                column[i] = vectors.get(i).get(features.get(f));
            }
            means[f] = mean.evaluate(column);
            stds[f] = population.evaluate(column);
            if (!Double.isFinite(stds[f]) || stds[f] < MIN_STD) {
                throw new ClusteringFailedException("Feature " + features.get(f)
                        + " has no variance across the selected counties");
            }
        }

        List<EntityPoint> points = new ArrayList<>(vectors.size());
        for (FeatureVector vector : vectors) {
            double[] coordinates = new double[features.size()];
            Map<ClusterFeature, Double> scaled = new EnumMap<>(ClusterFeature.class);
            for (int f = 0; f < features.size(); f++) {
                coordinates[f] = (vector.get(features.get(f)) - means[f]) / stds[f];
                scaled.put(features.get(f), coordinates[f]);
            }
            points.add(new EntityPoint(new FeatureVector(vector.getEntity(), scaled), coordinates));
        }
        return points;
    }

    private static final class EntityPoint implements Clusterable {
        private final FeatureVector vector;
        private final double[] coordinates;

        EntityPoint(FeatureVector vector, double[] coordinates) {
            this.vector = vector;
            this.coordinates = coordinates;
        }

        @Override
        public double[] getPoint() {
            return coordinates;
        }
    }
}
