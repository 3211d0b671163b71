package com.covidanalytics.infrastructure.query;

import lombok.Value;

import java.util.List;

/**
 * SQL text with positional placeholders and the values bound to them.
 * Two signatures are equal when both the text and the parameters are equal,
 * which makes this the result cache key.
 */
@Value
public class QuerySignature {

    String sql;
    List<Object> parameters;

    public QuerySignature(String sql, List<?> parameters) {
        this.sql = sql;
        this.parameters = List.copyOf(parameters);
    }
}
