package com.covidanalytics.infrastructure.query;

import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.DateRange;
import com.covidanalytics.domain.model.DemographicCategory;
import com.covidanalytics.domain.model.FilterSet;
import com.covidanalytics.domain.model.Interval;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryBuilderTest {

    private static final String TREND = "CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CA_TREND_MV";

    @Test
    void testBuild_MonthlyTrendForCounty() {
        FilterSet filters = FilterSet.builder().entity("Los Angeles").build();

        QuerySignature signature = QueryBuilder.from(WarehouseTable.TREND)
                .selectPeriod(Interval.MONTH)
                .selectAggregate(AggregateFunction.SUM, Column.TOTAL_CASES)
                .where(filters)
                .groupByPeriod(Interval.MONTH)
                .orderBy(Column.PERIOD, SortDirection.ASC)
                .build();

        assertEquals("SELECT DATE_TRUNC('MONTH', DATE) AS PERIOD, SUM(TOTAL_CASES) AS TOTAL_CASES"
                + " FROM " + TREND
                + " WHERE 1=1 AND AREA = ?"
                + " GROUP BY DATE_TRUNC('MONTH', DATE)"
                + " ORDER BY PERIOD ASC", signature.getSql());
        assertEquals(List.of("Los Angeles"), signature.getParameters());
    }

    @Test
    void testBuild_DailyPeriodUsesDateColumn() {
        QuerySignature signature = QueryBuilder.from(WarehouseTable.TREND)
                .selectPeriod(Interval.DAY)
                .selectAggregate(AggregateFunction.AVG, Column.CASES_PER_100K)
                .where(FilterSet.empty())
                .groupByPeriod(Interval.DAY)
                .build();

        assertEquals("SELECT DATE AS PERIOD, AVG(CASES_PER_100K) AS CASES_PER_100K FROM " + TREND
                + " WHERE 1=1 GROUP BY DATE", signature.getSql());
        assertTrue(signature.getParameters().isEmpty());
    }

    @Test
    void testBuild_RangeAndLimitAreBound() {
        DateRange range = DateRange.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 3, 31));

        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS_AGG)
                .select(Column.AREA)
                .selectAggregate(AggregateFunction.AVG, Column.DEATHS_PER_100K)
                .where(FilterSet.builder().dateRange(range).build())
                .groupBy(Column.AREA)
                .orderBy(AggregateFunction.AVG, Column.DEATHS_PER_100K, SortDirection.DESC)
                .limit(5)
                .build();

        assertTrue(signature.getSql().contains("WHERE 1=1 AND DATE BETWEEN ? AND ?"));
        assertTrue(signature.getSql().endsWith("ORDER BY AVG(DEATHS_PER_100K) DESC LIMIT ?"));
        assertEquals(List.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 3, 31), 5), signature.getParameters());
    }

    @Test
    void testBuild_OpenEndedRanges() {
        LocalDate day = LocalDate.of(2022, 6, 1);

        QuerySignature from = QueryBuilder.from(WarehouseTable.CASES).selectAll()
                .where(FilterSet.builder().dateRange(DateRange.of(day, null)).build())
                .build();
        QuerySignature until = QueryBuilder.from(WarehouseTable.CASES).selectAll()
                .where(FilterSet.builder().dateRange(DateRange.of(null, day)).build())
                .build();

        assertTrue(from.getSql().endsWith("WHERE 1=1 AND DATE >= ?"));
        assertTrue(until.getSql().endsWith("WHERE 1=1 AND DATE <= ?"));
        assertEquals(List.of(day), from.getParameters());
        assertEquals(List.of(day), until.getParameters());
    }

    @Test
    void testBuild_CategoryBindsLabel() {
        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS)
                .selectAll()
                .where(FilterSet.builder()
                        .category(DemographicCategory.AGE_GROUP)
                        .date(LocalDate.of(2021, 5, 4))
                        .build())
                .build();

        assertEquals("SELECT * FROM CALIFORNIA_COVID_ANALYTICS.ANALYTICS.CASES_DEMOGRAPHICS"
                + " WHERE 1=1 AND REPORT_DATE = ? AND DEMOGRAPHIC_CATEGORY = ?", signature.getSql());
        assertEquals(List.of(LocalDate.of(2021, 5, 4), "Age Group"), signature.getParameters());
    }

    @Test
    void testBuild_SameFiltersSameSignature() {
        FilterSet first = FilterSet.builder().entity("Alameda").date(LocalDate.of(2022, 12, 31)).build();
        FilterSet second = FilterSet.builder().entity("Alameda").date(LocalDate.of(2022, 12, 31)).build();

        QuerySignature a = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS_VIEW).selectAll().where(first).build();
        QuerySignature b = QueryBuilder.from(WarehouseTable.CASES_DEMOGRAPHICS_VIEW).selectAll().where(second).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testBuild_EntityValueNeverInlined() {
        String hostile = "Alameda'; DROP TABLE CASES; --";

        QuerySignature signature = QueryBuilder.from(WarehouseTable.CASES)
                .selectAll()
                .where(FilterSet.builder().entity(hostile).build())
                .build();

        assertFalse(signature.getSql().contains("DROP"));
        assertEquals(List.of(hostile), signature.getParameters());
    }

    @Test
    void testWhere_UnsupportedRoleRejected() {
        FilterSet byCategory = FilterSet.builder().category(DemographicCategory.GENDER).build();
        FilterSet byDate = FilterSet.builder().date(LocalDate.of(2021, 1, 1)).build();

        assertThrows(InvalidFilterException.class,
                () -> QueryBuilder.from(WarehouseTable.TREND).selectAll().where(byCategory));
        assertThrows(InvalidFilterException.class,
                () -> QueryBuilder.from(WarehouseTable.COUNTY_DEMOGRAPHICS).selectAll().where(byDate));
    }

    @Test
    void testWhere_DateAndRangeRejected() {
        FilterSet filters = FilterSet.builder()
                .date(LocalDate.of(2021, 1, 1))
                .dateRange(DateRange.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 31)))
                .build();

        assertThrows(InvalidFilterException.class,
                () -> QueryBuilder.from(WarehouseTable.CASES).selectAll().where(filters));
    }

    @Test
    void testLimit_MustBePositive() {
        assertThrows(InvalidFilterException.class, () -> QueryBuilder.from(WarehouseTable.CASES).limit(0));
    }

    @Test
    void testBuild_RequiresSelectItems() {
        assertThrows(IllegalStateException.class, () -> QueryBuilder.from(WarehouseTable.CASES).build());
    }
}
