package com.covidanalytics.infrastructure.cache;

import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.infrastructure.query.QuerySignature;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheEndpointTest {

    private ResultCache cache;
    private ResultCacheEndpoint endpoint;

    @BeforeEach
    void setUp() {
        cache = new ResultCache(2, new SimpleMeterRegistry());
        endpoint = new ResultCacheEndpoint(cache);
    }

    @Test
    void testSummary_ReportsSizeCapacityAndCounts() {
        // Given
        cache.getOrCompute(signature("A"), ResultCacheEndpointTest::empty);
        cache.getOrCompute(signature("A"), ResultCacheEndpointTest::empty);
        cache.getOrCompute(signature("B"), ResultCacheEndpointTest::empty);
        cache.getOrCompute(signature("C"), ResultCacheEndpointTest::empty);

        // When
        Map<String, Object> summary = endpoint.summary();

        // Then
        assertEquals(2L, summary.get("size"));
        assertEquals(2L, summary.get("maxEntries"));
        assertEquals(1L, summary.get("hitCount"));
        assertEquals(3L, summary.get("missCount"));
        assertEquals(1L, summary.get("evictionCount"));
    }

    @Test
    void testClear_DropsEveryEntry() {
        cache.getOrCompute(signature("A"), ResultCacheEndpointTest::empty);
        cache.getOrCompute(signature("B"), ResultCacheEndpointTest::empty);

        endpoint.clear();

        assertEquals(0L, cache.size());
        assertFalse(cache.contains(signature("A")));
    }

    private static QuerySignature signature(String area) {
        return new QuerySignature("SELECT * FROM CASES WHERE 1=1 AND AREA = ?", List.of(area));
    }

    private static ResultTable empty() {
        return ResultTable.of(List.of("AREA"), List.of());
    }
}
