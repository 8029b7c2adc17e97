package com.tenantoptions.database.migration;

import java.util.Arrays;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an app's migration directory with Flyway, recording it in the app's own history table.
 * <p>
 * Every app gets a separate Flyway instance: its own file-system location and its own
 * {@code {app}_schema_history} table, so one app's migrations never shadow another's versions.
 * Existing schemas are baselined at version 0 and {@code clean} is disabled.
 *
 * <pre>{@code
 * var runner = new FlywayMigrationRunner(dataSource, locations);
 * MigrationStatus status = runner.migrate("tasks", null);
 * }</pre>
 */
public class FlywayMigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationRunner.class);

    /**
     * One migration as Flyway reports it.
     *
     * @param app app label
     * @param version migration version, null for repeatable migrations
     * @param description migration description
     * @param state Flyway state (e.g. "Success", "Pending")
     * @param installedOn installation time, null when not applied
     */
    public record MigrationInfo(String app, String version, String description, String state, String installedOn) {}

    /**
     * Migration status of one app.
     *
     * @param app app label
     * @param location directory the migrations were read from
     * @param appliedMigrations number of applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version, null if nothing is applied
     */
    public record MigrationStatus(
            String app, String location, int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final DataSource dataSource;
    private final MigrationLocations locations;

    public FlywayMigrationRunner(DataSource dataSource, MigrationLocations locations) {
        this.dataSource = dataSource;
        this.locations = locations;
    }

    /**
     * Applies pending migrations of the app.
     *
     * @param app app label
     * @param override directory replacing the configured location, may be null
     * @return status after migrating
     */
    public MigrationStatus migrate(String app, MigrationDirectory override) {
        MigrationDirectory directory = override != null ? override : locations.directoryFor(app, null);
        Flyway flyway = createFlyway(app, directory);
        MigrateResult result = flyway.migrate();
        log.info("Applied {} migration(s) for app {} from {}", result.migrationsExecuted, app, directory.path());
        return status(app, directory, flyway.info());
    }

    /** Reports applied and pending migrations without changing anything. */
    public MigrationStatus status(String app, MigrationDirectory override) {
        MigrationDirectory directory = override != null ? override : locations.directoryFor(app, null);
        return status(app, directory, createFlyway(app, directory).info());
    }

    /** Lists every migration Flyway knows for the app, applied or pending. */
    public List<MigrationInfo> migrations(String app, MigrationDirectory override) {
        MigrationDirectory directory = override != null ? override : locations.directoryFor(app, null);
        return Arrays.stream(createFlyway(app, directory).info().all())
                .map(info -> new MigrationInfo(
                        app,
                        info.getVersion() == null ? null : info.getVersion().getVersion(),
                        info.getDescription(),
                        info.getState().getDisplayName(),
                        info.getInstalledOn() == null ? null : info.getInstalledOn().toInstant().toString()))
                .toList();
    }

    // ── Private Helpers ──

    private MigrationStatus status(String app, MigrationDirectory directory, MigrationInfoService info) {
        var current = info.current();
        return new MigrationStatus(
                app,
                directory.path().toString(),
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }

    private Flyway createFlyway(String app, MigrationDirectory directory) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations("filesystem:" + directory.path().toAbsolutePath())
                .table(locations.historyTable(app))
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .cleanDisabled(true)
                .load();
    }
}
