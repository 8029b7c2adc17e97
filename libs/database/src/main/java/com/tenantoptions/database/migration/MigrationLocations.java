package com.tenantoptions.database.migration;

import java.nio.file.Path;

/** Resolves migration directories and history tables per app. */
public class MigrationLocations {

    private final MigrationProperties properties;

    public MigrationLocations(MigrationProperties properties) {
        this.properties = properties;
    }

    /**
     * Returns the app's directory, or the override when one is given.
     *
     * @param app app label
     * @param override directory from the command line, may be null
     */
    public MigrationDirectory directoryFor(String app, Path override) {
        return new MigrationDirectory(override != null ? override : Path.of(properties.location()).resolve(app));
    }

    public String historyTable(String app) {
        return properties.historyTablePattern().replace("{app}", app);
    }
}
