package com.di.enrichment.config;

import com.di.enrichment.model.DataTypes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single binding for all enrichment pipeline configuration.
 *
 * <pre>
 * enrichment:
 *   persistence-enabled: false
 *   cache:
 *     retention:
 *       "[driving-record]": 7d
 *       "[prior-claims]": 30d
 *       background: 7d
 *       credit: 30d
 *     default-retention: 7d
 *     cleanup-enabled: true
 *     cleanup-cron: "0 0 * * * *"
 *   provider:
 *     timeout: 10s
 *   fallback:
 *     stale-confidence-factor: 0.5
 *   providers:
 *     simulated-enabled: true
 *     simulated-failure-rate: 0.0
 *   default-configs:
 *     - entity-kind: claim
 *       data-types: prior-claims,background,credit
 *       fallback-behavior: skip
 *       priority-order: 1
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentProperties {

    /**
     * When true, cache entries, tasks and configuration records live in the JDBC store
     * ({@code enrichment.datasource.*}); otherwise everything is kept in memory.
     */
    private boolean persistenceEnabled = false;

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Provider provider = new Provider();

    @Valid
    private Fallback fallback = new Fallback();

    @Valid
    private Providers providers = new Providers();

    @Valid
    private ConfigCache configCache = new ConfigCache();

    private Datasource datasource = new Datasource();

    /** Configuration records seeded into the in-memory configuration store. */
    private List<DefaultConfig> defaultConfigs = new ArrayList<>();

    @Data
    public static class Cache {

        /** Retention window per data type. Data types not listed use {@link #defaultRetention}. */
        private Map<String, Duration> retention = defaultRetention();

        @NotNull
        private Duration defaultRetention = Duration.ofDays(7);

        /** Enables the scheduled removal of expired cache rows. */
        private boolean cleanupEnabled = true;

        private String cleanupCron = "0 0 * * * *";

        private static Map<String, Duration> defaultRetention() {
            Map<String, Duration> m = new LinkedHashMap<>();
            m.put(DataTypes.DRIVING_RECORD, Duration.ofDays(7));
            m.put(DataTypes.PRIOR_CLAIMS, Duration.ofDays(30));
            m.put(DataTypes.BACKGROUND, Duration.ofDays(7));
            m.put(DataTypes.CREDIT, Duration.ofDays(30));
            return m;
        }
    }

    @Data
    public static class Provider {
        /** Upper bound for one provider call; a slower call counts as a provider failure. */
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Fallback {
        /** Multiplier applied to the confidence of an expired entry substituted under use_cached. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double staleConfidenceFactor = 0.5;
    }

    @Data
    public static class Providers {
        /** Registers the simulated provider adapters (no real external services behind them). */
        private boolean simulatedEnabled = true;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double simulatedFailureRate = 0.0;

        private Duration simulatedLatency = Duration.ZERO;
    }

    @Data
    public static class ConfigCache {
        private int maxSize = 16;
        @NotNull
        private Duration expireAfterWrite = Duration.ofMinutes(5);
    }

    @Data
    public static class Datasource {
        private String url;
        private String username;
        private String password;
        private String driverClassName;
        private int maximumPoolSize = 5;
        /** Runs {@code schema/enrichment_tables.sql} (idempotent) when the pool is created. */
        private boolean initializeSchema = true;
    }

    @Data
    public static class DefaultConfig {
        private String entityKind;
        private List<String> dataTypes = new ArrayList<>();
        private boolean autoEnrich = true;
        private int priorityOrder = 1;
        private String fallbackBehavior = "skip";
    }
}
