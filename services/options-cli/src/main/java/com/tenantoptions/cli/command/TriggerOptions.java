package com.tenantoptions.cli.command;

import com.tenantoptions.database.trigger.TriggerCommandOptions;
import com.tenantoptions.model.DatabaseVendor;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/** Options shared by {@code make-triggers} and {@code remove-triggers}. */
public class TriggerOptions {

    @Option(names = "--app", description = "Only process models of this app")
    String app;

    @Option(names = "--model", description = "Only process this model (app.Model)")
    String model;

    @Option(names = "--dry-run", description = "Show what would be generated without writing files")
    boolean dryRun;

    @Option(names = "--migration-dir", description = "Write migrations here instead of the app's configured location")
    Path migrationDir;

    @Option(names = "--interactive", description = "Confirm each migration before it is written")
    boolean interactive;

    @Option(names = "--verbose", description = "Print additional detail")
    boolean verbose;

    @Option(names = "--db-vendor-override", description = "Generate SQL for this vendor (sqlite, postgresql, mysql, oracle)")
    String vendorOverride;

    TriggerCommandOptions.Builder toBuilder(DatabaseVendor vendor) {
        return TriggerCommandOptions.builder(vendor)
                .app(app)
                .model(model)
                .migrationDir(migrationDir)
                .dryRun(dryRun)
                .interactive(interactive)
                .verbose(verbose);
    }
}
