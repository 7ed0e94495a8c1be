package com.strata.hierarchy;

import com.strata.hierarchy.config.HierarchyServiceProperties;
import com.strata.hierarchy.config.SecurityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Hierarchy service: clusters, domains and resources with membership-based access control.
 *
 * <p>Scans {@code com.strata} so the session propagation and migration configuration from the
 * database library is picked up.
 */
@SpringBootApplication(scanBasePackages = "com.strata")
@EnableConfigurationProperties({HierarchyServiceProperties.class, SecurityProperties.class})
public class HierarchyServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(HierarchyServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HierarchyServiceApplication.class, args);
        log.info("Strata hierarchy service started");
    }
}
