package com.di.enrichment.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * JDBC wiring for the persistent stores. Only active with {@code enrichment.persistence-enabled=true};
 * Spring Boot's own DataSource auto-configuration is excluded on the application class.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "enrichment.persistence-enabled", havingValue = "true")
public class PersistenceConfig {

    static final String SCHEMA_SCRIPT = "schema/enrichment_tables.sql";

    @Bean(destroyMethod = "close")
    public HikariDataSource enrichmentDataSource(EnrichmentProperties properties) {
        EnrichmentProperties.Datasource ds = properties.getDatasource();
        if (ds.getUrl() == null || ds.getUrl().isBlank()) {
            throw new IllegalStateException("enrichment.datasource.url is required when enrichment.persistence-enabled=true");
        }
        HikariConfig config = new HikariConfig();
        config.setPoolName("enrichment-pool");
        config.setJdbcUrl(ds.getUrl());
        config.setUsername(ds.getUsername());
        config.setPassword(ds.getPassword());
        if (ds.getDriverClassName() != null && !ds.getDriverClassName().isBlank()) {
            config.setDriverClassName(ds.getDriverClassName());
        }
        config.setMaximumPoolSize(ds.getMaximumPoolSize());
        log.info("[PERSISTENCE] Creating connection pool for {}", ds.getUrl());
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcTemplate enrichmentJdbcTemplate(DataSource enrichmentDataSource) {
        return new JdbcTemplate(enrichmentDataSource);
    }

    @Bean
    public DataSourceInitializer enrichmentSchemaInitializer(DataSource enrichmentDataSource,
                                                             EnrichmentProperties properties) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(enrichmentDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)));
        initializer.setEnabled(properties.getDatasource().isInitializeSchema());
        return initializer;
    }
}
