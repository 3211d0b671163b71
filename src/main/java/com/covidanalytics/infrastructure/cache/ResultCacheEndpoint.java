package com.covidanalytics.infrastructure.cache;

import com.google.common.cache.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator view of the result cache.
 *
 * GET /actuator/resultcache     - size, capacity and hit/miss/eviction counts
 * DELETE /actuator/resultcache  - drop every entry (after a warehouse reload)
 */
@Slf4j
@Component
@Endpoint(id = "resultcache")
@RequiredArgsConstructor
public class ResultCacheEndpoint {

    private final ResultCache resultCache;

    @ReadOperation
    public Map<String, Object> summary() {
        CacheStats stats = resultCache.stats();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("size", resultCache.size());
        summary.put("maxEntries", resultCache.getMaxEntries());
        summary.put("hitCount", stats.hitCount());
        summary.put("missCount", stats.missCount());
        summary.put("evictionCount", stats.evictionCount());
        return summary;
    }

    @DeleteOperation
    public void clear() {
        log.info("Clearing result cache on operator request ({} entries)", resultCache.size());
        resultCache.invalidateAll();
    }
}
