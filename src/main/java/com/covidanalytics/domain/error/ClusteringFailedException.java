package com.covidanalytics.domain.error;

/**
 * Standardization or k-means partitioning failed numerically.
 */
public class ClusteringFailedException extends AnalyticsException {

    public ClusteringFailedException(String message) {
        super(ErrorKind.CLUSTERING_FAILED, message);
    }

    public ClusteringFailedException(String message, Throwable cause) {
        super(ErrorKind.CLUSTERING_FAILED, message, cause);
    }
}
