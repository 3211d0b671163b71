package com.covidanalytics.infrastructure.warehouse;

import com.covidanalytics.domain.error.InvalidFilterException;
import com.covidanalytics.domain.model.ResultRow;
import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.infrastructure.cache.ResultCache;
import com.covidanalytics.infrastructure.query.Column;
import com.covidanalytics.infrastructure.query.QueryBuilder;
import com.covidanalytics.infrastructure.query.QuerySignature;
import com.covidanalytics.infrastructure.query.SortDirection;
import com.covidanalytics.infrastructure.query.WarehouseTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Valid county names, read from the demographics table.
 *
 * The lookup goes through the result cache like any other query, so the
 * directory is fetched once and then served from memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityDirectory {

    private static final QuerySignature COUNTY_NAMES = QueryBuilder.from(WarehouseTable.COUNTY_DEMOGRAPHICS)
            .select(Column.COUNTY_NAME)
            .orderBy(Column.COUNTY_NAME, SortDirection.ASC)
            .build();

    private final WarehouseClient warehouseClient;
    private final ResultCache resultCache;

    public Set<String> entities() {
        ResultTable table = resultCache.getOrCompute(COUNTY_NAMES, () -> warehouseClient.execute(COUNTY_NAMES));
        Set<String> names = new LinkedHashSet<>();
        for (ResultRow row : table.getRows()) {
            Object name = row.get(Column.COUNTY_NAME);
            if (name != null) {
                names.add(name.toString());
            }
        }
        return names;
    }

    public boolean contains(String entity) {
        return entity != null && entities().contains(entity.trim());
    }

    public void requireKnown(String entity) {
        if (!contains(entity)) {
            log.debug("Rejected unknown county: {}", entity);
            throw new InvalidFilterException("Unknown county '" + entity + "'");
        }
    }
}
