package com.covidanalytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    @Valid
    private final Cache cache = new Cache();

    @Valid
    private final Query query = new Query();

    @Valid
    private final Warehouse warehouse = new Warehouse();

    @Valid
    private final Forecast forecast = new Forecast();

    @Valid
    private final Cluster cluster = new Cluster();

    @Data
    public static class Cache {
        /**
         * Distinct query signatures kept before the least recently used one is evicted.
         */
        @Min(1)
        private long maxEntries = 512;
    }

    @Data
    public static class Query {
        /**
         * Upper bound for the row limit of ranking queries.
         */
        @Min(1)
        private int maxLimit = 100;
    }

    @Data
    public static class Warehouse {
        /**
         * Per-statement timeout; a query running longer fails as upstream unavailable.
         */
        @Min(1)
        private int queryTimeoutSeconds = 30;
    }

    @Data
    public static class Forecast {
        @Min(1)
        private int maxHorizon = 60;

        /**
         * Objective evaluations allowed to the ARIMA optimizer before the fit is declared non-convergent.
         */
        @Min(10)
        private int maxEvaluations = 5000;
    }

    @Data
    public static class Cluster {
        private long seed = 42L;

        @Min(1)
        private int maxIterations = 300;

        @Min(2)
        private int maxClusters = 10;
    }
}
