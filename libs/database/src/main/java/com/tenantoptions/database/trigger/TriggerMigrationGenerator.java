package com.tenantoptions.database.trigger;

import com.tenantoptions.database.OperatorConsole;
import com.tenantoptions.database.migration.MigrationDirectory;
import com.tenantoptions.database.migration.MigrationFile;
import com.tenantoptions.database.migration.MigrationHistory;
import com.tenantoptions.database.migration.MigrationLocations;
import com.tenantoptions.database.migration.MigrationOperation;
import com.tenantoptions.database.migration.MigrationScript;
import com.tenantoptions.database.migration.MigrationSequence;
import com.tenantoptions.model.ModelRegistry;
import com.tenantoptions.model.OptionModel;
import com.tenantoptions.model.SelectionModel;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one migration per selection model installing its tenant consistency trigger.
 *
 * <h2>Output</h2>
 *
 * <p>Files are named {@code V{nnnn}__auto_trigger_{model}.sql} and land in the app's migration
 * directory. A model whose trigger is already created by an earlier migration is skipped unless
 * {@link TriggerCommandOptions#force()} is set.
 *
 * <pre>{@code
 * var generator = new TriggerMigrationGenerator(registry, history, locations, Clock.systemUTC());
 * GenerationResult result = generator.generate(
 *         TriggerCommandOptions.builder(DatabaseVendor.POSTGRESQL).app("tasks").build(), console);
 * }</pre>
 */
public class TriggerMigrationGenerator {

    private static final Logger log = LoggerFactory.getLogger(TriggerMigrationGenerator.class);

    private final ModelRegistry registry;
    private final MigrationHistory history;
    private final MigrationLocations locations;
    private final Clock clock;
    private final TriggerScanner scanner = new TriggerScanner();

    public TriggerMigrationGenerator(
            ModelRegistry registry, MigrationHistory history, MigrationLocations locations, Clock clock) {
        this.registry = registry;
        this.history = history;
        this.locations = locations;
        this.clock = clock;
    }

    public GenerationResult generate(TriggerCommandOptions options, OperatorConsole console) {
        TriggerDialect dialect = TriggerDialects.forVendor(options.vendor());
        MigrationSequence sequence = new MigrationSequence(history);
        List<MigrationFile> migrations = new ArrayList<>();
        List<String> triggers = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (SelectionModel model : TargetModels.select(registry, options, console)) {
            if (options.verbose()) {
                console.info("Processing model: " + model.label());
            }
            OptionModel optionModel = registry.optionModelFor(model).orElse(null);
            if (optionModel == null) {
                console.warning("Model %s has no option model. Skipping...".formatted(model.label()));
                continue;
            }

            TriggerTarget target = TriggerTarget.of(model, optionModel, options.vendor());
            String app = model.label().app();
            MigrationDirectory directory = locations.directoryFor(app, options.migrationDir());

            if (!options.force()
                    && scanner.isInstalled(
                            target.triggerName(), model.label().modelName(), directory, history.applied(app))) {
                console.info("Trigger '%s' for model '%s' already exists. Skipping..."
                        .formatted(target.triggerName(), model.label()));
                skipped.add(target.triggerName());
                continue;
            }
            if (options.interactive()
                    && !console.confirm("Do you want to create a migration for %s? (y/n)".formatted(model.label()))) {
                console.info("Migration creation for %s skipped by user.".formatted(model.label()));
                skipped.add(target.triggerName());
                continue;
            }

            MigrationSequence.Slot slot =
                    sequence.next(app, directory, "auto_trigger_" + model.label().modelName());
            var operation = new MigrationOperation(
                    "create trigger " + target.triggerName(),
                    dialect.createScript(target),
                    dialect.dropScript(target.triggerName(), target.selectionTable()));
            String content = new MigrationScript(
                            clock.instant(), slot.dependsOn(), List.of(target.triggerName()), List.of(operation))
                    .render();

            if (options.dryRun()) {
                console.info("[DRY RUN] Migration would be created: " + slot.file().path());
                if (options.verbose()) {
                    console.info(content);
                }
            } else {
                directory.write(slot.file(), content);
                console.success("Migration created: " + slot.file().path());
                log.info("Wrote trigger migration {} for {}", slot.file().fileName(), model.label());
            }
            migrations.add(slot.file());
            triggers.add(target.triggerName());
        }
        return new GenerationResult(migrations, triggers, skipped, options.dryRun());
    }
}
