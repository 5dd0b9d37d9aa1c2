package com.di.enrichment.support;

import com.di.enrichment.sql.SqlQueriesProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.UUID;

/**
 * Loads the production {@code sql-queries.yml} and schema into a private H2 database, so the JDBC
 * stores run against the same statements they use in production.
 */
public final class SqlQueriesFixture {

    private SqlQueriesFixture() {
    }

    public static SqlQueriesProperties sqlQueries() {
        try {
            List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                    .load("sql-queries", new ClassPathResource("sql-queries.yml"));
            StandardEnvironment environment = new StandardEnvironment();
            sources.forEach(environment.getPropertySources()::addLast);
            return Binder.get(environment).bind("enrichment.sql", SqlQueriesProperties.class)
                    .orElseThrow(() -> new IllegalStateException("enrichment.sql not found in sql-queries.yml"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Fresh in-memory H2 database (PostgreSQL mode) with the enrichment schema applied.
     */
    public static DataSource h2WithSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:enrichment-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        dataSource.setDriverClassName("org.h2.Driver");
        new ResourceDatabasePopulator(new ClassPathResource("schema/enrichment_tables.sql")).execute(dataSource);
        return dataSource;
    }
}
