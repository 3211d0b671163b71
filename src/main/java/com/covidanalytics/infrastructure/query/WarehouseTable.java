package com.covidanalytics.infrastructure.query;

import lombok.Getter;

import java.util.Optional;

/**
 * Allow-list of the warehouse tables and views this service reads.
 *
 * Each entry names the columns playing the entity, date and category roles so
 * the builder can translate a {@code FilterSet} without caller-supplied
 * identifiers. A null role means the table cannot be filtered that way.
 */
@Getter
public enum WarehouseTable {

    COUNTY_DEMOGRAPHICS("CALIFORNIA_COVID_ANALYTICS.RAW.CA_COUNTY_DEMOGRAPHICS_2020",
            Column.COUNTY_NAME, null, null),

    CASES("CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CASES",
            Column.AREA, Column.DATE, null),

    CASES_DEMOGRAPHICS("CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CASES_DEMOGRAPHICS",
            null, Column.REPORT_DATE, Column.DEMOGRAPHIC_CATEGORY),

    HOSPITALS("CALIFORNIA_COVID_ANALYTICS.ANALYTICS.HOSPITALS_BY_COUNTY",
            Column.COUNTY, Column.TODAYS_DATE, null),

    CASES_DEMOGRAPHICS_VIEW("CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CA_CASES_DEMOGRAPHICS_VIEW",
            Column.AREA, Column.DATE, null),

    CASES_DEMOGRAPHICS_AGG("CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CA_CASES_DEMOGRAPHICS_AGG",
            Column.AREA, Column.DATE, null),

    TREND("CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CA_TREND_MV",
            Column.AREA, Column.DATE, null);

    private final String qualifiedName;
    private final Column entityColumn;
    private final Column dateColumn;
    private final Column categoryColumn;

    WarehouseTable(String qualifiedName, Column entityColumn, Column dateColumn, Column categoryColumn) {
        this.qualifiedName = qualifiedName;
        this.entityColumn = entityColumn;
        this.dateColumn = dateColumn;
        this.categoryColumn = categoryColumn;
    }

    public Optional<Column> entity() {
        return Optional.ofNullable(entityColumn);
    }

    public Optional<Column> date() {
        return Optional.ofNullable(dateColumn);
    }

    public Optional<Column> category() {
        return Optional.ofNullable(categoryColumn);
    }
}
