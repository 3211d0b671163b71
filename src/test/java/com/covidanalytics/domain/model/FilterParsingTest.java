package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing of request values into the closed filter enumerations and ranges.
 */
class FilterParsingTest {

    @Test
    void testMetricFromName() {
        assertEquals(Metric.CASES_PER_100K, Metric.fromName("Cases_Per_100k"));
        InvalidFilterException ex = assertThrows(InvalidFilterException.class, () -> Metric.fromName("hospitalizations"));
        assertTrue(ex.getMessage().contains("cases_per_100k"));
        assertThrows(InvalidFilterException.class, () -> Metric.fromName(null));
    }

    @Test
    void testIntervalFromName() {
        assertEquals(Interval.DAY, Interval.fromName(null));
        assertEquals(Interval.MONTH, Interval.fromName("MONTH"));
        assertThrows(InvalidFilterException.class, () -> Interval.fromName("week"));
        assertEquals(LocalDate.of(2021, 2, 1), Interval.MONTH.next(LocalDate.of(2021, 1, 1)));
        assertEquals(LocalDate.of(2021, 1, 1), Interval.DAY.next(LocalDate.of(2020, 12, 31)));
    }

    @Test
    void testCategoryAndFeatureFromName() {
        assertEquals(DemographicCategory.RACE_ETHNICITY, DemographicCategory.fromName("race_ethnicity"));
        assertEquals(DemographicCategory.AGE_GROUP, DemographicCategory.fromName("Age Group"));
        assertThrows(InvalidFilterException.class, () -> DemographicCategory.fromName("Income"));

        assertEquals(ClusterFeature.B_POPULATION_RATIO, ClusterFeature.fromName("b_population_ratio"));
        assertThrows(InvalidFilterException.class, () -> ClusterFeature.fromName("median_income"));
    }

    @Test
    void testDateRange() {
        LocalDate jan = LocalDate.of(2021, 1, 1);
        LocalDate feb = LocalDate.of(2021, 2, 1);

        assertNull(DateRange.ofNullable(null, null));
        assertThrows(InvalidFilterException.class, () -> DateRange.of(null, null));
        assertThrows(InvalidFilterException.class, () -> DateRange.of(feb, jan));
        assertTrue(DateRange.of(jan, jan).isSingleDay());
        assertFalse(DateRange.of(jan, null).isSingleDay());
    }

    @Test
    void testFilterSet_DateAndRangeRejected() {
        FilterSet filters = FilterSet.builder()
                .date(LocalDate.of(2021, 1, 5))
                .dateRange(DateRange.of(LocalDate.of(2021, 1, 1), LocalDate.of(2021, 1, 31)))
                .build();

        assertThrows(InvalidFilterException.class, filters::validate);
        assertThrows(InvalidFilterException.class, () -> FilterSet.builder().entity("  ").build().validate());
        assertEquals(Interval.DAY, FilterSet.empty().getInterval());
    }

    @Test
    void testLookupResult_NotFoundThrows() {
        LookupResult<String> missing = LookupResult.notFound("nothing here");

        NotFoundException ex = assertThrows(NotFoundException.class, missing::orElseThrow);
        assertEquals("nothing here", ex.getMessage());
        assertEquals(List.of("a"), LookupResult.found("a").orElseThrow());
    }
}
