package com.tenantoptions.cli.command;

import com.tenantoptions.database.migration.FlywayMigrationRunner;
import com.tenantoptions.database.migration.FlywayMigrationRunner.MigrationStatus;
import com.tenantoptions.database.migration.MigrationDirectory;
import com.tenantoptions.database.migration.MigrationLocations;
import com.tenantoptions.model.ModelRegistry;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Applies pending migrations of each app with Flyway. */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Command(name = "migrate", mixinStandardHelpOptions = true, description = "Apply generated migrations to the database")
public class MigrateCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--app", description = "Only migrate this app")
    String app;

    @Option(names = "--migration-dir", description = "Read migrations from here instead of the app's configured location")
    Path migrationDir;

    @Option(names = "--status", description = "Report applied and pending migrations without migrating")
    boolean statusOnly;

    private final ModelRegistry registry;
    private final MigrationLocations locations;
    private final FlywayMigrationRunner runner;

    public MigrateCommand(ModelRegistry registry, MigrationLocations locations, FlywayMigrationRunner runner) {
        this.registry = registry;
        this.locations = locations;
        this.runner = runner;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<String> apps = app != null ? List.of(app) : registry.apps();
        for (String each : apps) {
            MigrationDirectory directory = locations.directoryFor(each, migrationDir);
            if (directory.files().isEmpty()) {
                out.printf("No migrations for %s in %s%n", each, directory.path());
                continue;
            }
            MigrationStatus status = statusOnly ? runner.status(each, directory) : runner.migrate(each, directory);
            out.printf("%s: %d applied, %d pending, current version %s%n",
                    each,
                    status.appliedMigrations(),
                    status.pendingMigrations(),
                    status.currentVersion() == null ? "(none)" : status.currentVersion());
        }
        return 0;
    }
}
