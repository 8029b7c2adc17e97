package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.nio.file.Path;

/**
 * Options shared by trigger generation and removal.
 *
 * <pre>{@code
 * var options = TriggerCommandOptions.builder(DatabaseVendor.POSTGRESQL)
 *         .app("tasks")
 *         .dryRun(true)
 *         .build();
 * }</pre>
 *
 * @param app restrict to one app, may be null
 * @param model restrict to one model, {@code app.Model} or a bare model name, may be null
 * @param migrationDir directory overriding the configured per-app location, may be null
 * @param vendor vendor the SQL is generated for
 * @param dryRun report what would be written without writing
 * @param interactive confirm each migration
 * @param verbose print extra detail
 * @param force generate even when the trigger already exists (generation only)
 * @param verify skip triggers missing from the live database (removal only)
 */
public record TriggerCommandOptions(
        String app,
        String model,
        Path migrationDir,
        DatabaseVendor vendor,
        boolean dryRun,
        boolean interactive,
        boolean verbose,
        boolean force,
        boolean verify) {

    public TriggerCommandOptions {
        if (vendor == null) {
            throw new IllegalArgumentException("vendor must not be null");
        }
    }

    public static Builder builder(DatabaseVendor vendor) {
        return new Builder(vendor);
    }

    public static final class Builder {

        private final DatabaseVendor vendor;
        private String app;
        private String model;
        private Path migrationDir;
        private boolean dryRun;
        private boolean interactive;
        private boolean verbose;
        private boolean force;
        private boolean verify;

        private Builder(DatabaseVendor vendor) {
            this.vendor = vendor;
        }

        public Builder app(String app) {
            this.app = app;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder migrationDir(Path migrationDir) {
            this.migrationDir = migrationDir;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder interactive(boolean interactive) {
            this.interactive = interactive;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public TriggerCommandOptions build() {
            return new TriggerCommandOptions(
                    app, model, migrationDir, vendor, dryRun, interactive, verbose, force, verify);
        }
    }
}
