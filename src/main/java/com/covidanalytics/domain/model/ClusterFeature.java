package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.infrastructure.query.Column;
import lombok.Getter;

import java.util.Arrays;

/**
 * County-level features available to the clustering pipeline.
 */
@Getter
public enum ClusterFeature {
    CASES_PER_100K(Column.CASES_PER_100K),
    DEATHS_PER_100K(Column.DEATHS_PER_100K),
    MALE_POPULATION_RATIO(Column.MALE_POPULATION_RATIO),
    FEMALE_POPULATION_RATIO(Column.FEMALE_POPULATION_RATIO),
    W_POPULATION_RATIO(Column.W_POPULATION_RATIO),
    B_POPULATION_RATIO(Column.B_POPULATION_RATIO),
    O_POPULATION_RATIO(Column.O_POPULATION_RATIO),
    NH_POPULATION_RATIO(Column.NH_POPULATION_RATIO),
    HI_POPULATION_RATIO(Column.HI_POPULATION_RATIO),
    NA_POPULATION_RATIO(Column.NA_POPULATION_RATIO),
    AGE_0_19_POPULATION_RATIO(Column.AGE_0_19_POPULATION_RATIO),
    AGE_20_49_POPULATION_RATIO(Column.AGE_20_49_POPULATION_RATIO),
    AGE_50_64_POPULATION_RATIO(Column.AGE_50_64_POPULATION_RATIO),
    AGE_65_PLUS_POPULATION_RATIO(Column.AGE_65_PLUS_POPULATION_RATIO);

    private final Column column;

    ClusterFeature(Column column) {
        this.column = column;
    }

    public static ClusterFeature fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase();
            for (ClusterFeature feature : values()) {
                if (feature.name().equals(normalized)) {
                    return feature;
                }
            }
        }
        throw new InvalidFilterException("Invalid clustering feature '" + name + "'. Choose from "
                + Arrays.toString(values()));
    }
}
