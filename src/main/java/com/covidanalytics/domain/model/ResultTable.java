package com.covidanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.HashSet;
import java.util.List;

/**
 * Ordered rows returned by one warehouse query. Every row has the same columns.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ResultTable {

    private static final ResultTable EMPTY = new ResultTable(List.of(), List.of());

    private final List<String> columns;
    private final List<ResultRow> rows;

    private ResultTable(List<String> columns, List<ResultRow> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static ResultTable of(List<String> columns, List<ResultRow> rows) {
        List<String> cols = List.copyOf(columns);
        HashSet<String> expected = new HashSet<>(cols);
        for (ResultRow row : rows) {
            if (!row.columns().equals(expected)) {
                throw new IllegalArgumentException("Row columns " + row.columns() + " differ from " + cols);
            }
        }
        return new ResultTable(cols, List.copyOf(rows));
    }

    public static ResultTable empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public ResultRow first() {
        return rows.get(0);
    }

    @JsonValue
    public List<ResultRow> asList() {
        return rows;
    }
}
