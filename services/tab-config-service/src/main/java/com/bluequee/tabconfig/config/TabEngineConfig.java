package com.bluequee.tabconfig.config;

import com.bluequee.observability.MetricFactory;
import com.bluequee.tabconfig.domain.port.TabConfigStore;
import com.bluequee.tabconfig.domain.service.OverrideWriter;
import com.bluequee.tabconfig.domain.service.SystemTabCatalog;
import com.bluequee.tabconfig.domain.service.SystemTabSeeder;
import com.bluequee.tabconfig.domain.service.TabConfigService;
import com.bluequee.tabconfig.domain.service.TabReorderer;
import com.bluequee.tabconfig.domain.service.TabResolver;
import com.bluequee.tabconfig.infrastructure.persistence.JdbcTabConfigStore;
import com.bluequee.tabconfig.infrastructure.persistence.SettingsCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the framework-free domain classes to the JDBC store.
 *
 * <p>WHY explicit {@code @Bean} methods instead of stereotype annotations: the domain package stays
 * free of Spring imports.
 */
@Configuration
public class TabEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(TabEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TabConfigStore tabConfigStore(
            NamedParameterJdbcTemplate jdbc,
            PlatformTransactionManager transactionManager,
            ObjectMapper objectMapper,
            Clock clock) {
        return new JdbcTabConfigStore(
                jdbc, new TransactionTemplate(transactionManager), new SettingsCodec(objectMapper), clock);
    }

    @Bean
    public TabResolver tabResolver(TabConfigStore store) {
        return new TabResolver(store);
    }

    @Bean
    public OverrideWriter overrideWriter(TabConfigStore store, TabResolver resolver) {
        return new OverrideWriter(store, resolver);
    }

    @Bean
    public TabReorderer tabReorderer(TabConfigStore store) {
        return new TabReorderer(store);
    }

    @Bean
    public TabConfigService tabConfigService(
            TabConfigStore store, TabResolver resolver, OverrideWriter writer, TabReorderer reorderer) {
        return new TabConfigService(store, resolver, writer, reorderer);
    }

    @Bean
    public SystemTabCatalog systemTabCatalog() {
        return new SystemTabCatalog();
    }

    @Bean
    public SystemTabSeeder systemTabSeeder(
            TabConfigStore store, SystemTabCatalog catalog, TabCatalogProperties properties) {
        return new SystemTabSeeder(store, catalog, properties.mandatoryTabs());
    }

    /** Seeds missing system tabs once the context is up. A failure aborts startup. */
    @Bean
    public ApplicationRunner systemTabSeeding(
            SystemTabSeeder seeder, TabCatalogProperties properties, MetricFactory metrics) {
        return args -> {
            if (!properties.seedOnStartup()) {
                log.info("System tab seeding disabled");
                return;
            }
            try {
                int inserted = seeder.ensureSeeded();
                metrics.counter("tabconfig.seeded", "System tabs inserted at startup").increment(inserted);
            } catch (RuntimeException e) {
                log.error("System tab seeding failed", e);
                throw e;
            }
        };
    }
}
