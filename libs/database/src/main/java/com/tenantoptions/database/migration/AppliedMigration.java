package com.tenantoptions.database.migration;

import java.util.Optional;

/**
 * A row of an app's Flyway history table.
 *
 * @param version version as recorded by Flyway, null for baseline or repeatable entries
 * @param description migration description
 * @param script script file name
 * @param success whether the migration completed
 */
public record AppliedMigration(String version, String description, String script, boolean success) {

    /** Numeric version, empty when the recorded version is not a plain integer. */
    public Optional<Integer> numericVersion() {
        if (version == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(version.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
