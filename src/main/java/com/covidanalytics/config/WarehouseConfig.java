package com.covidanalytics.config;

import com.covidanalytics.infrastructure.cache.ResultCache;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class WarehouseConfig {

    @Bean
    public JdbcTemplate warehouseJdbcTemplate(DataSource dataSource, AnalyticsProperties props) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setQueryTimeout(props.getWarehouse().getQueryTimeoutSeconds());
        log.info("Warehouse query timeout set to {}s", props.getWarehouse().getQueryTimeoutSeconds());
        return template;
    }

    @Bean
    public ResultCache resultCache(AnalyticsProperties props, MeterRegistry meterRegistry) {
        return new ResultCache(props.getCache().getMaxEntries(), meterRegistry);
    }
}
