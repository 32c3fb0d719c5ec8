package com.bluequee.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration.
 *
 * <p>WHY a separate connection from {@code spring.datasource}: migrations run with a schema-owner
 * account while the service pool uses a least-privilege account. Bean Validation fails startup on
 * missing fields rather than at migration time.
 *
 * <pre>{@code
 * bluequee:
 *   flyway:
 *     records:
 *       url: jdbc:postgresql://localhost:5432/bluequee
 *       username: bluequee_owner
 *       password: ${RECORDS_DB_OWNER_PASSWORD}
 *       locations: classpath:db/migration/records
 *       enabled: true
 * }</pre>
 *
 * @param records records database (tab configuration and other tenant data)
 */
@Validated
@ConfigurationProperties(prefix = "bluequee.flyway")
public record FlywayConfigProperties(@NotNull @Valid DatabaseConfig records) {

    /** Default location of the records database scripts. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/records";

    /**
     * Configuration for one database's Flyway instance.
     *
     * @param url JDBC connection URL
     * @param username database username
     * @param password database password
     * @param locations Flyway script locations, defaults to {@link #DEFAULT_LOCATIONS}
     * @param enabled whether to migrate on startup
     */
    public record DatabaseConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            String locations,
            boolean enabled) {

        public DatabaseConfig {
            if (locations == null || locations.isBlank()) {
                locations = DEFAULT_LOCATIONS;
            }
        }
    }
}
