package com.tenantoptions.database.migration;

import java.util.List;

/** Read access to the migrations already applied for an app. */
public interface MigrationHistory {

    /** Applied migrations in installation order; empty when the app has no history yet. */
    List<AppliedMigration> applied(String app);

    /** History for environments without a database. */
    static MigrationHistory none() {
        return app -> List.of();
    }
}
