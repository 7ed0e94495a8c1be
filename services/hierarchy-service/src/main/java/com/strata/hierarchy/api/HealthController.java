package com.strata.hierarchy.api;

import com.strata.hierarchy.config.HierarchyServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated liveness probe. Readiness, including the database, is on the actuator. */
@RestController
public class HealthController {

    private final HierarchyServiceProperties properties;

    public HealthController(HierarchyServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/up")
    public Map<String, Object> up() {
        return Map.of(
                "status", "up",
                "service", properties.name(),
                "environment", properties.environment(),
                "timestamp", Instant.now().toString());
    }
}
