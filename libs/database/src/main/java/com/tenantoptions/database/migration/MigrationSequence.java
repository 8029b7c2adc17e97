package com.tenantoptions.database.migration;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Allocates migration versions for one generator run.
 * <p>
 * The next version of an app is one past the highest of its applied history, its files on disk
 * and the versions handed out earlier in the same run. Dry runs write nothing, so the run's own
 * allocations keep consecutive models of one app from colliding. The migration holding that
 * highest version becomes the new file's dependency.
 */
public class MigrationSequence {

    /**
     * A reserved file and the migration it follows.
     *
     * @param file the file to write
     * @param dependsOn file name of the preceding migration, null when it is the app's first
     */
    public record Slot(MigrationFile file, String dependsOn) {}

    private final MigrationHistory history;
    private final Map<String, MigrationFile> allocated = new HashMap<>();

    public MigrationSequence(MigrationHistory history) {
        this.history = history;
    }

    /** Reserves the next file for the app. */
    public Slot next(String app, MigrationDirectory directory, String description) {
        int highest = 0;
        String predecessor = null;

        for (AppliedMigration migration : history.applied(app)) {
            Integer version = migration.numericVersion().orElse(null);
            if (version != null && version > highest) {
                highest = version;
                predecessor = migration.script();
            }
        }
        List<MigrationFile> files = directory.files();
        if (!files.isEmpty()) {
            MigrationFile latest = files.get(files.size() - 1);
            if (latest.version() >= highest) {
                highest = latest.version();
                predecessor = latest.fileName();
            }
        }
        MigrationFile previous = allocated.get(app);
        if (previous != null && previous.version() >= highest) {
            highest = previous.version();
            predecessor = previous.fileName();
        }

        MigrationFile file = directory.file(highest + 1, description);
        allocated.put(app, file);
        return new Slot(file, predecessor);
    }
}
