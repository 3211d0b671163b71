package com.covidanalytics.infrastructure.query;

/**
 * Physical column names known to the warehouse views, plus the aliases the
 * builder emits. Identifiers in generated SQL come only from this enum.
 */
public enum Column {
    // entity and time
    COUNTY_NAME,
    AREA,
    COUNTY,
    DATE,
    REPORT_DATE,
    TODAYS_DATE,
    DEMOGRAPHIC_CATEGORY,

    // case and death metrics
    TOTAL_CASES,
    TOTAL_DEATHS,
    CASES_PER_100K,
    DEATHS_PER_100K,

    // demographic ratios
    MALE_POPULATION_RATIO,
    FEMALE_POPULATION_RATIO,
    W_POPULATION_RATIO,
    B_POPULATION_RATIO,
    O_POPULATION_RATIO,
    NH_POPULATION_RATIO,
    HI_POPULATION_RATIO,
    NA_POPULATION_RATIO,
    AGE_0_19_POPULATION_RATIO,
    AGE_20_49_POPULATION_RATIO,
    AGE_50_64_POPULATION_RATIO,
    AGE_65_PLUS_POPULATION_RATIO,

    // alias for a bucketed date expression
    PERIOD;

    public String sql() {
        return name();
    }
}
