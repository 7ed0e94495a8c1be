package com.strata.hierarchy.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HierarchyServiceProperties")
class HierarchyServicePropertiesTest {

    @Test
    @DisplayName("keeps the given values")
    void acceptsValues() {
        var props =
                new HierarchyServiceProperties(
                        "hierarchy-service", "production", "desc", List.of("https://a.example"));

        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.corsAllowedOrigins()).containsExactly("https://a.example");
    }

    @Test
    @DisplayName("defaults environment to development and origins to none")
    void defaults() {
        var props = new HierarchyServiceProperties("hierarchy-service", " ", null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.corsAllowedOrigins()).isEmpty();
    }
}
