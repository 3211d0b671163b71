package com.covidanalytics.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.OptionalDouble;
import java.util.Optional;

/**
 * Lenient conversion of warehouse scalars. Anything that cannot be read as
 * the requested type comes back empty so the caller can drop the row.
 */
final class Scalars {

    private Scalars() {
    }

    static Optional<LocalDate> toDate(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof java.sql.Date sqlDate) {
            return Optional.of(sqlDate.toLocalDate());
        }
        if (value instanceof java.sql.Timestamp timestamp) {
            return Optional.of(timestamp.toLocalDateTime().toLocalDate());
        }
        if (value instanceof OffsetDateTime offset) {
            return Optional.of(offset.toLocalDate());
        }
        if (value instanceof ZonedDateTime zoned) {
            return Optional.of(zoned.toLocalDate());
        }
        if (value instanceof Instant instant) {
            return Optional.of(instant.atOffset(ZoneOffset.UTC).toLocalDate());
        }
        if (value instanceof java.util.Date date) {
            return Optional.of(date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate());
        }
        String text = value.toString().trim();
        if (text.length() < 10) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(text.substring(0, 10)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static OptionalDouble toDouble(Object value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        double d;
        if (value instanceof Number number) {
            d = number.doubleValue();
        } else {
            try {
                d = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
}
