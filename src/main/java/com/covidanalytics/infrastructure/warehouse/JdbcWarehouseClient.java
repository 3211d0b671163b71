package com.covidanalytics.infrastructure.warehouse;

import com.covidanalytics.domain.error.UpstreamUnavailableException;
import com.covidanalytics.domain.error.WarehouseQueryException;
import com.covidanalytics.domain.model.ResultRow;
import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.infrastructure.query.QuerySignature;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Warehouse access over JDBC.
 *
 * Connections come from the pooled DataSource behind {@link JdbcTemplate} and
 * are returned after every call. The query timeout is configured on the
 * template. There are no retries; a circuit breaker fails fast while the
 * warehouse keeps failing.
 *
 * Failure mapping:
 * - connection, timeout and other transient failures: UpstreamUnavailableException
 * - statements the warehouse rejects: WarehouseQueryException
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcWarehouseClient implements WarehouseClient {

    private static final ResultSetExtractor<ResultTable> EXTRACTOR = JdbcWarehouseClient::extract;

    private final JdbcTemplate jdbcTemplate;

    @Override
    @CircuitBreaker(name = "warehouse", fallbackMethod = "circuitOpen")
    public ResultTable execute(QuerySignature signature) {
        long startTime = System.currentTimeMillis();
        try {
            PreparedStatementSetter setter = ps -> bind(ps, signature.getParameters());
            ResultTable table = jdbcTemplate.query(signature.getSql(), setter, EXTRACTOR);

            log.info("Warehouse query executed: {} rows, {} ms",
                    table.size(), System.currentTimeMillis() - startTime);
            return table;

        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | RecoverableDataAccessException e) {
            log.error("Warehouse query failed after {} ms: {}",
                    System.currentTimeMillis() - startTime, signature.getSql(), e);
            throw new UpstreamUnavailableException("Warehouse query failed: " + e.getMostSpecificCause().getMessage(), e);

        } catch (DataAccessException e) {
            log.error("Warehouse rejected query after {} ms: {}",
                    System.currentTimeMillis() - startTime, signature.getSql(), e);
            throw new WarehouseQueryException("Warehouse rejected query", e);
        }
    }

    // Fallback (circuit breaker)

    private ResultTable circuitOpen(QuerySignature signature, CallNotPermittedException e) {
        log.warn("Warehouse circuit breaker open, rejecting query");
        throw new UpstreamUnavailableException("Warehouse temporarily unavailable: circuit breaker open", e);
    }

    private static void bind(PreparedStatement ps, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            if (value instanceof LocalDate date) {
                ps.setDate(i + 1, java.sql.Date.valueOf(date));
            } else {
                ps.setObject(i + 1, value);
            }
        }
    }

    private static ResultTable extract(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();

        Set<String> labels = new LinkedHashSet<>();
        for (int i = 1; i <= count; i++) {
            labels.add(meta.getColumnLabel(i));
        }

        List<ResultRow> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= count; i++) {
                values.put(meta.getColumnLabel(i), normalize(rs.getObject(i)));
            }
            rows.add(new ResultRow(values));
        }
        return ResultTable.of(new ArrayList<>(labels), rows);
    }

    private static Object normalize(Object value) {
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        return value;
    }
}
