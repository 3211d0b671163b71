package com.covidanalytics.domain.model;

import com.covidanalytics.domain.error.NotFoundException;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a lookup: a single record, a list of records, or nothing.
 * Callers match on the variant instead of inspecting the payload shape.
 */
public sealed interface LookupResult<T> permits LookupResult.Found, LookupResult.FoundMany, LookupResult.NotFound {

    static <T> LookupResult<T> found(T value) {
        return new Found<>(value);
    }

    static <T> LookupResult<T> foundMany(List<T> values) {
        return new FoundMany<>(List.copyOf(values));
    }

    static <T> LookupResult<T> notFound(String reason) {
        return new NotFound<>(reason);
    }

    /** Every record carried by this result; throws for {@link NotFound}. */
    List<T> orElseThrow();

    @Value
    final class Found<T> implements LookupResult<T> {
        T value;

        @Override
        public List<T> orElseThrow() {
            return List.of(value);
        }
    }

    @Value
    final class FoundMany<T> implements LookupResult<T> {
        List<T> values;

        @Override
        public List<T> orElseThrow() {
            return values;
        }
    }

    @Value
    final class NotFound<T> implements LookupResult<T> {
        String reason;

        public NotFoundException toException() {
            return new NotFoundException(reason);
        }

        @Override
        public List<T> orElseThrow() {
            throw toException();
        }
    }
}
