package com.bluequee.tabconfig.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code bluequee.service.*}.
 *
 * <pre>
 * bluequee:
 *   service:
 *     name: tab-config-service
 *     environment: production
 *     description: Scoped patient tab configuration
 * </pre>
 *
 * @param name service name used for logging, metrics and tracing. Required.
 * @param environment deployment environment, defaults to "development"
 * @param description human-readable description returned by {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "bluequee.service")
@Validated
public record TabConfigServiceProperties(
        @NotBlank String name, String environment, String description) {

    /** Runs before Bean Validation, so defaults satisfy constraints. */
    public TabConfigServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
