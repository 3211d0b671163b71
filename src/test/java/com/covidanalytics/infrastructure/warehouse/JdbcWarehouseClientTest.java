package com.covidanalytics.infrastructure.warehouse;

import com.covidanalytics.domain.error.UpstreamUnavailableException;
import com.covidanalytics.domain.error.WarehouseQueryException;
import com.covidanalytics.domain.model.ResultRow;
import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.infrastructure.query.QuerySignature;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Runs the JDBC client against an in-memory H2 database.
 */
class JdbcWarehouseClientTest {

    private JdbcWarehouseClient client;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);

        jdbcTemplate.execute("CREATE TABLE COUNTY_CASES (AREA VARCHAR(64), REPORT_DAY DATE, TOTAL_CASES INT)");
        jdbcTemplate.update("INSERT INTO COUNTY_CASES VALUES ('Alameda', DATE '2022-12-30', 120)");
        jdbcTemplate.update("INSERT INTO COUNTY_CASES VALUES ('Alameda', DATE '2022-12-31', 95)");
        jdbcTemplate.update("INSERT INTO COUNTY_CASES VALUES ('Fresno', DATE '2022-12-31', 40)");

        client = new JdbcWarehouseClient(jdbcTemplate);
    }

    @Test
    void testExecute_BindsParametersAndPreservesColumnOrder() {
        // Given
        QuerySignature signature = new QuerySignature(
                "SELECT AREA, REPORT_DAY, TOTAL_CASES FROM COUNTY_CASES"
                        + " WHERE 1=1 AND AREA = ? AND REPORT_DAY >= ? ORDER BY REPORT_DAY ASC",
                List.of("Alameda", LocalDate.of(2022, 12, 30)));

        // When
        ResultTable table = client.execute(signature);

        // Then
        assertEquals(List.of("AREA", "REPORT_DAY", "TOTAL_CASES"), table.getColumns());
        assertEquals(2, table.size());

        ResultRow first = table.first();
        assertEquals("Alameda", first.get("AREA"));
        assertEquals(LocalDate.of(2022, 12, 30), first.get("REPORT_DAY"));
        assertEquals(120, ((Number) first.get("TOTAL_CASES")).intValue());
    }

    @Test
    void testExecute_NoMatchesGivesEmptyTable() {
        QuerySignature signature = new QuerySignature(
                "SELECT * FROM COUNTY_CASES WHERE 1=1 AND AREA = ?", List.of("Alpine"));

        ResultTable table = client.execute(signature);

        assertTrue(table.isEmpty());
        assertEquals(3, table.getColumns().size());
    }

    @Test
    void testExecute_LimitBoundAsParameter() {
        QuerySignature signature = new QuerySignature(
                "SELECT AREA, AVG(TOTAL_CASES) AS TOTAL_CASES FROM COUNTY_CASES WHERE 1=1"
                        + " GROUP BY AREA ORDER BY AVG(TOTAL_CASES) DESC LIMIT ?",
                List.of(1));

        ResultTable table = client.execute(signature);

        assertEquals(1, table.size());
        assertEquals("Alameda", table.first().get("AREA"));
    }

    @Test
    void testExecute_MissingTableIsRejectedQuery() {
        QuerySignature signature = new QuerySignature("SELECT * FROM MISSING_TABLE", List.of());

        WarehouseQueryException ex = assertThrows(WarehouseQueryException.class,
                () -> client.execute(signature));

        assertEquals("Warehouse rejected query", ex.getMessage());
        assertNotNull(ex.getCause());
    }

    @Test
    void testExecute_ConnectionFailureIsUpstreamUnavailable() throws SQLException {
        // Given
        DataSource unreachable = mock(DataSource.class);
        when(unreachable.getConnection()).thenThrow(new SQLException("Connection refused"));
        JdbcWarehouseClient offline = new JdbcWarehouseClient(new JdbcTemplate(unreachable));
        QuerySignature signature = new QuerySignature("SELECT * FROM COUNTY_CASES", List.of());

        // When
        UpstreamUnavailableException ex = assertThrows(UpstreamUnavailableException.class,
                () -> offline.execute(signature));

        // Then
        assertTrue(ex.getMessage().startsWith("Warehouse query failed"));
        assertTrue(ex.getMessage().contains("Connection refused"));
    }
}
