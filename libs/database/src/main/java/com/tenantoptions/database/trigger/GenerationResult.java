package com.tenantoptions.database.trigger;

import com.tenantoptions.database.migration.MigrationFile;
import java.util.List;

/**
 * Outcome of a trigger generation or removal run.
 *
 * @param migrations files written, or that would have been written on a dry run
 * @param triggers triggers covered by those files
 * @param skipped triggers left alone
 * @param dryRun whether anything was written
 */
public record GenerationResult(
        List<MigrationFile> migrations, List<String> triggers, List<String> skipped, boolean dryRun) {

    public GenerationResult {
        migrations = List.copyOf(migrations);
        triggers = List.copyOf(triggers);
        skipped = List.copyOf(skipped);
    }
}
