package com.di.enrichment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The pooled DataSource is built by {@link com.di.enrichment.config.PersistenceConfig} only when
 * {@code enrichment.persistence-enabled=true}, so Boot's DataSource auto-configuration stays off.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
@EnableScheduling
public class EnrichmentPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(EnrichmentPipelineApplication.class, args);
	}
}
