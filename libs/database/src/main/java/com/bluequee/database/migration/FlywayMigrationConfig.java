package com.bluequee.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the records database.
 *
 * <p>The bean is created with {@code initMethod = "migrate"}, so the schema is current before any
 * bean that depends on {@link #RECORDS_FLYWAY_BEAN} (or any {@code ApplicationRunner}) executes.
 *
 * <p>Services using this module must turn off Spring Boot's own {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "bluequee.flyway.records", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name of the records database Flyway instance. */
    public static final String RECORDS_FLYWAY_BEAN = "recordsFlyway";

    @Bean(name = RECORDS_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway recordsFlyway(FlywayConfigProperties properties) {
        FlywayConfigProperties.DatabaseConfig config = properties.records();
        log.info("Configuring Flyway for records database at {} ({})", config.url(), config.locations());
        return createFlyway(config);
    }

    /**
     * Builds a Flyway instance with its own connection.
     *
     * <p>{@code cleanDisabled} is always on: wiping a clinical records schema is never a startup
     * concern.
     */
    static Flyway createFlyway(FlywayConfigProperties.DatabaseConfig config) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(config.url())
                        .username(config.username())
                        .password(config.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
