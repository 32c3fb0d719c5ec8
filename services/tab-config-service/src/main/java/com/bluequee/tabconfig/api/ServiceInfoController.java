package com.bluequee.tabconfig.api;

import com.bluequee.tabconfig.config.TabConfigServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight info endpoint for operational visibility. Actuator's {@code /actuator/info} carries
 * build metadata; this adds service-specific runtime information.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final TabConfigServiceProperties properties;

    public ServiceInfoController(TabConfigServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
