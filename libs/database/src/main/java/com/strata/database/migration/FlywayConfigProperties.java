package com.strata.database.migration;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Schema migration settings, bound from {@code strata.flyway.*}.
 *
 * <pre>{@code
 * strata:
 *   flyway:
 *     enabled: true
 *     locations:
 *       - classpath:db/migration/common
 *       - classpath:db/migration/{vendor}
 *     app-role: strata_app
 * }</pre>
 *
 * <p>{@code {vendor}} is replaced with the database vendor id ({@code postgresql}, {@code h2}) so
 * engine-specific scripts such as the row-level-security policies only run where they apply.
 *
 * @param enabled whether to migrate on startup
 * @param locations Flyway script locations; {@code {vendor}} is expanded
 * @param appRole database role the application connects as on PostgreSQL; receives table grants
 */
@Validated
@ConfigurationProperties(prefix = "strata.flyway")
public record FlywayConfigProperties(
        Boolean enabled, List<String> locations, @NotBlank String appRole) {

    public static final String VENDOR_PLACEHOLDER = "{vendor}";

    public FlywayConfigProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null || locations.isEmpty()) {
            locations =
                    List.of("classpath:db/migration/common", "classpath:db/migration/{vendor}");
        }
        if (appRole == null || appRole.isBlank()) {
            appRole = "strata_app";
        }
    }

    /** Locations with {@code {vendor}} replaced. */
    public List<String> locationsFor(String vendorId) {
        return locations.stream().map(l -> l.replace(VENDOR_PLACEHOLDER, vendorId)).toList();
    }
}
