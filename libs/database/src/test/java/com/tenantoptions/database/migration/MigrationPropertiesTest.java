package com.tenantoptions.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationProperties")
class MigrationPropertiesTest {

    @Test
    @DisplayName("should default the location and history table pattern")
    void shouldApplyDefaults() {
        var properties = MigrationProperties.defaults();

        assertThat(properties.location()).isEqualTo("db/migration");
        assertThat(properties.historyTablePattern()).isEqualTo("{app}_schema_history");
    }

    @Test
    @DisplayName("should resolve per-app directories and history tables")
    void shouldResolvePerApp() {
        var locations = new MigrationLocations(new MigrationProperties("migrations", "flyway_{app}"));

        assertThat(locations.directoryFor("tasks", null).path()).isEqualTo(Path.of("migrations", "tasks"));
        assertThat(locations.directoryFor("tasks", Path.of("elsewhere")).path()).isEqualTo(Path.of("elsewhere"));
        assertThat(locations.historyTable("tasks")).isEqualTo("flyway_tasks");
    }
}
