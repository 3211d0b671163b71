package com.covidanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * California COVID-19 Analytics Core
 *
 * Read-only analytics over a county-level case, death, hospital and
 * demographic warehouse.
 *
 * Architecture:
 * - REST APIs for filtered lookups, rankings and trends
 * - Parameterized warehouse queries built from closed column enums
 * - In-process LRU result cache shared by every request
 * - ARIMA(1,1,1) forecasting of county trends
 * - K-means clustering of counties on standardized features
 */
@SpringBootApplication
public class CovidAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CovidAnalyticsApplication.class, args);
    }
}
