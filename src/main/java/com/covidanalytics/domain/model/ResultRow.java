package com.covidanalytics.domain.model;

import com.covidanalytics.infrastructure.query.Column;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One warehouse row: column name to scalar value, in select order.
 * Values are strings, numbers, dates or null.
 */
@EqualsAndHashCode
@ToString
public final class ResultRow {

    private final Map<String, Object> values;

    public ResultRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        if (values.containsKey(column)) {
            return values.get(column);
        }
        // drivers differ on identifier case
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public Object get(Column column) {
        return get(column.sql());
    }

    public Set<String> columns() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }
}
