package com.strata.database.session;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Session propagation settings, bound from {@code strata.session.*}.
 *
 * <pre>
 * strata:
 *   session:
 *     statement-timeout: 30s
 * </pre>
 *
 * @param statementTimeout per-statement timeout on bound sessions; zero disables it
 */
@Validated
@ConfigurationProperties(prefix = "strata.session")
public record SessionProperties(Duration statementTimeout) {

    public SessionProperties {
        if (statementTimeout == null || statementTimeout.isNegative()) {
            statementTimeout = Duration.ofSeconds(30);
        }
    }
}
