package com.covidanalytics.infrastructure.cache;

import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.infrastructure.query.QuerySignature;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * In-process cache for warehouse query results.
 *
 * Keyed by {@link QuerySignature} (SQL text plus bound parameters), so two
 * requests share an entry only when they would issue the identical query.
 *
 * Caching Strategy:
 * - Bounded by entry count, least-recently-used entry evicted first
 * - No time-based expiry: an entry stays valid until evicted or
 *   {@link #invalidateAll()} is called, exposed to operators as
 *   {@code DELETE /actuator/resultcache} for use after a warehouse reload
 * - Concurrent misses for the same signature share one computation
 * - Failed computations are never stored
 */
@Slf4j
public class ResultCache {

    private final Cache<QuerySignature, ResultTable> cache;
    private final MeterRegistry meterRegistry;
    private final long maxEntries;

    public ResultCache(long maxEntries, MeterRegistry meterRegistry) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache capacity must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.meterRegistry = Objects.requireNonNull(meterRegistry);
        // one segment keeps eviction strictly LRU across all keys
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxEntries)
                .concurrencyLevel(1)
                .recordStats()
                .build();
        log.info("Result cache initialized (maxEntries={})", maxEntries);
    }

    /**
     * Returns the cached result for the signature, computing it on a miss.
     *
     * The supplier runs at most once per miss, even with concurrent callers.
     * Whatever it throws reaches the caller unchanged and nothing is cached.
     */
    public ResultTable getOrCompute(QuerySignature signature, Supplier<ResultTable> compute) {
        AtomicBoolean computed = new AtomicBoolean(false);
        ResultTable result;
        try {
            result = cache.get(signature, () -> {
                computed.set(true);
                return Objects.requireNonNull(compute.get(), "Query computation returned null");
            });
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Query computation failed", cause);
        }

        if (computed.get()) {
            log.debug("Cache miss for query: {}", signature);
            record("miss");
        } else {
            log.debug("Cache hit for query: {}", signature);
            record("hit");
        }
        return result;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Result cache cleared");
    }

    /** Does not count as an access for eviction order. */
    public boolean contains(QuerySignature signature) {
        return cache.asMap().containsKey(signature);
    }

    public long size() {
        return cache.size();
    }

    public long getMaxEntries() {
        return maxEntries;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private void record(String result) {
        Counter.builder("query.cache")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
