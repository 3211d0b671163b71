package com.covidanalytics.infrastructure.warehouse;

import com.covidanalytics.domain.model.ResultTable;
import com.covidanalytics.infrastructure.query.QuerySignature;

/**
 * Executes one parameterized query against the warehouse.
 *
 * Implementations release their connection before returning and report
 * connectivity or timeout failures as
 * {@link com.covidanalytics.domain.error.UpstreamUnavailableException}.
 */
public interface WarehouseClient {

    ResultTable execute(QuerySignature signature);
}
