package com.bluequee.tabconfig;

import com.bluequee.database.migration.FlywayMigrationConfig;
import com.bluequee.tabconfig.config.TabCatalogProperties;
import com.bluequee.tabconfig.config.TabConfigServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Tab configuration service: resolves which patient record tabs a viewer sees and applies
 * organization, role and user overrides on top of the system defaults.
 *
 * <ul>
 *   <li>Schema migrated by the records Flyway bean from {@code bluequee-database}
 *   <li>Identity forwarded by the gateway in the {@code X-Security-Context} header
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Errors as RFC 7807 ProblemDetail
 * </ul>
 */
@SpringBootApplication
@Import(FlywayMigrationConfig.class)
@EnableConfigurationProperties({TabConfigServiceProperties.class, TabCatalogProperties.class})
public class TabConfigServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TabConfigServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TabConfigServiceApplication.class, args);
        log.info("Tab configuration service started");
    }
}
