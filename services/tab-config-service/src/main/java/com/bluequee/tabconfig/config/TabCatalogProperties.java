package com.bluequee.tabconfig.config;

import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * System tab seeding, bound from {@code bluequee.tabs.*}.
 *
 * @param seedOnStartup insert missing catalog tabs when the service starts (default true)
 * @param mandatoryTabs catalog keys seeded as mandatory; only affects newly inserted tabs
 */
@ConfigurationProperties(prefix = "bluequee.tabs")
@Validated
public record TabCatalogProperties(Boolean seedOnStartup, Set<String> mandatoryTabs) {

    public TabCatalogProperties {
        if (seedOnStartup == null) {
            seedOnStartup = Boolean.TRUE;
        }
        mandatoryTabs = mandatoryTabs == null ? Set.of() : Set.copyOf(mandatoryTabs);
    }
}
