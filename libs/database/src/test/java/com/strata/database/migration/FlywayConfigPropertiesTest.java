package com.strata.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlywayConfigProperties")
class FlywayConfigPropertiesTest {

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("enabled with common and vendor locations when nothing is configured")
        void defaultsApplied() {
            var props = new FlywayConfigProperties(null, null, null);

            assertThat(props.enabled()).isTrue();
            assertThat(props.locations())
                    .containsExactly(
                            "classpath:db/migration/common", "classpath:db/migration/{vendor}");
            assertThat(props.appRole()).isEqualTo("strata_app");
        }

        @Test
        @DisplayName("blank app role falls back to the default")
        void blankAppRole() {
            assertThat(new FlywayConfigProperties(true, List.of(), " ").appRole())
                    .isEqualTo("strata_app");
        }
    }

    @Nested
    @DisplayName("locationsFor")
    class LocationsFor {

        @Test
        @DisplayName("expands the vendor placeholder")
        void expandsVendor() {
            var props = new FlywayConfigProperties(null, null, null);

            assertThat(props.locationsFor("postgresql"))
                    .containsExactly(
                            "classpath:db/migration/common", "classpath:db/migration/postgresql");
        }

        @Test
        @DisplayName("leaves locations without the placeholder untouched")
        void keepsPlainLocations() {
            var props =
                    new FlywayConfigProperties(
                            true, List.of("filesystem:/opt/migrations"), "app");

            assertThat(props.locationsFor("h2")).containsExactly("filesystem:/opt/migrations");
        }
    }
}
