package com.covidanalytics.infrastructure.query;

import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.DateRange;
import com.covidanalytics.domain.model.FilterSet;
import com.covidanalytics.domain.model.Interval;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composes a parameterized aggregate query over one {@link WarehouseTable}.
 *
 * Identifiers (table, columns, functions, date truncation) are taken from
 * closed enums; every caller value (entity, dates, category, limit) is bound
 * through a {@code ?} placeholder. The WHERE clause always starts with
 * {@code 1=1} so predicates can be appended uniformly.
 *
 * <pre>
 * QuerySignature sig = QueryBuilder.from(WarehouseTable.TREND)
 *         .selectPeriod(Interval.MONTH)
 *         .selectAggregate(AggregateFunction.SUM, Column.TOTAL_CASES)
 *         .where(filters)
 *         .groupByPeriod(Interval.MONTH)
 *         .orderBy(Column.PERIOD, SortDirection.ASC)
 *         .build();
 * </pre>
 */
public final class QueryBuilder {

    private final WarehouseTable table;
    private final List<String> select = new ArrayList<>();
    private final List<String> where = new ArrayList<>();
    private final List<Object> parameters = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> orderBy = new ArrayList<>();
    private Integer limit;

    private QueryBuilder(WarehouseTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public static QueryBuilder from(WarehouseTable table) {
        return new QueryBuilder(table);
    }

    public QueryBuilder selectAll() {
        select.add("*");
        return this;
    }

    public QueryBuilder select(Column... columns) {
        for (Column column : columns) {
            select.add(column.sql());
        }
        return this;
    }

    /** {@code FN(column) AS column}. */
    public QueryBuilder selectAggregate(AggregateFunction function, Column column) {
        select.add(function.apply(column) + " AS " + column.sql());
        return this;
    }

    /** The table's date column, truncated to the interval, aliased {@code PERIOD}. */
    public QueryBuilder selectPeriod(Interval interval) {
        select.add(periodExpression(interval) + " AS " + Column.PERIOD.sql());
        return this;
    }

    /**
     * Appends one predicate per present filter, in a fixed order: entity,
     * exact date, date range, category.
     */
    public QueryBuilder where(FilterSet filters) {
        filters.validate();

        if (filters.hasEntity()) {
            Column column = table.entity().orElseThrow(() -> unsupported("an entity"));
            appendPredicate(column.sql() + " = ?", filters.getEntity().trim());
        }
        if (filters.getDate() != null) {
            Column column = table.date().orElseThrow(() -> unsupported("a date"));
            appendPredicate(column.sql() + " = ?", filters.getDate());
        }
        DateRange range = filters.getDateRange();
        if (range != null) {
            Column column = table.date().orElseThrow(() -> unsupported("a date range"));
            if (range.getStart() != null && range.getEnd() != null) {
                where.add(column.sql() + " BETWEEN ? AND ?");
                parameters.add(range.getStart());
                parameters.add(range.getEnd());
            } else if (range.getStart() != null) {
                appendPredicate(column.sql() + " >= ?", range.getStart());
            } else {
                appendPredicate(column.sql() + " <= ?", range.getEnd());
            }
        }
        if (filters.getCategory() != null) {
            Column column = table.category().orElseThrow(() -> unsupported("a category"));
            appendPredicate(column.sql() + " = ?", filters.getCategory().getLabel());
        }
        return this;
    }

    public QueryBuilder groupBy(Column... columns) {
        for (Column column : columns) {
            groupBy.add(column.sql());
        }
        return this;
    }

    public QueryBuilder groupByPeriod(Interval interval) {
        groupBy.add(periodExpression(interval));
        return this;
    }

    public QueryBuilder orderBy(Column column, SortDirection direction) {
        orderBy.add(column.sql() + " " + direction.name());
        return this;
    }

    public QueryBuilder orderBy(AggregateFunction function, Column column, SortDirection direction) {
        orderBy.add(function.apply(column) + " " + direction.name());
        return this;
    }

    public QueryBuilder limit(int limit) {
        if (limit < 1) {
            throw new InvalidFilterException("Limit must be positive, got " + limit);
        }
        this.limit = limit;
        return this;
    }

    public QuerySignature build() {
        if (select.isEmpty()) {
            throw new IllegalStateException("No select items for " + table);
        }
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(String.join(", ", select))
           .append(" FROM ").append(table.getQualifiedName())
           .append(" WHERE 1=1");
        for (String predicate : where) {
            sql.append(" AND ").append(predicate);
        }
        if (!groupBy.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }
        if (!orderBy.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }

        List<Object> params = new ArrayList<>(parameters);
        if (limit != null) {
            sql.append(" LIMIT ?");
            params.add(limit);
        }
        return new QuerySignature(sql.toString(), params);
    }

    private void appendPredicate(String predicate, Object value) {
        where.add(predicate);
        parameters.add(value);
    }

    private String periodExpression(Interval interval) {
        Column column = table.date().orElseThrow(() -> unsupported("a time bucket"));
        return switch (interval) {
            case MONTH -> "DATE_TRUNC('MONTH', " + column.sql() + ")";
            case DAY -> column.sql();
        };
    }

    private InvalidFilterException unsupported(String what) {
        return new InvalidFilterException(table + " has no column for " + what);
    }
}
