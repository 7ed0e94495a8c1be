package com.strata.hierarchy.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service settings, bound from {@code strata.service.*}.
 *
 * <pre>
 * strata:
 *   service:
 *     name: hierarchy-service
 *     environment: production
 *     cors-allowed-origins:
 *       - https://console.example.com
 * </pre>
 *
 * @param name service name, reported by {@code /up} and used in logs
 * @param environment deployment environment, {@code development} when unset
 * @param description human-readable description
 * @param corsAllowedOrigins origins allowed to call {@code /api/**} from a browser
 */
@ConfigurationProperties(prefix = "strata.service")
@Validated
public record HierarchyServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        List<String> corsAllowedOrigins) {

    public HierarchyServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        corsAllowedOrigins = corsAllowedOrigins == null ? List.of() : List.copyOf(corsAllowedOrigins);
    }
}
