package com.tenantoptions.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where migration files live and how history tables are named.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * tenant-options:
 *   migrations:
 *     location: db/migration
 *     history-table-pattern: "{app}_schema_history"
 * }</pre>
 *
 * <p>Each app gets its own directory below {@code location} and its own Flyway history table.
 *
 * @param location root directory holding one sub-directory per app
 * @param historyTablePattern history table name, {@code {app}} is replaced by the app label
 */
@Validated
@ConfigurationProperties(prefix = "tenant-options.migrations")
public record MigrationProperties(@NotBlank String location, @NotBlank String historyTablePattern) {

    public MigrationProperties {
        if (location == null || location.isBlank()) {
            location = "db/migration";
        }
        if (historyTablePattern == null || historyTablePattern.isBlank()) {
            historyTablePattern = "{app}_schema_history";
        }
    }

    public static MigrationProperties defaults() {
        return new MigrationProperties(null, null);
    }
}
