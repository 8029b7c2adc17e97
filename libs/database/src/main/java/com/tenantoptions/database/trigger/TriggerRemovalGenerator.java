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
import com.tenantoptions.model.SelectionModel;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code V{nnnn}__remove_triggers.sql} migrations dropping the tenant consistency triggers
 * that earlier migrations installed, one file per app.
 * <p>
 * Triggers already dropped by a later removal migration are not picked up again, so a second run
 * finds nothing to do. The removal cannot be reversed.
 */
public class TriggerRemovalGenerator {

    private static final Logger log = LoggerFactory.getLogger(TriggerRemovalGenerator.class);

    private final ModelRegistry registry;
    private final MigrationHistory history;
    private final MigrationLocations locations;
    private final Clock clock;
    private final TriggerScanner scanner = new TriggerScanner();

    public TriggerRemovalGenerator(
            ModelRegistry registry, MigrationHistory history, MigrationLocations locations, Clock clock) {
        this.registry = registry;
        this.history = history;
        this.locations = locations;
        this.clock = clock;
    }

    /**
     * Generates the removal migrations.
     *
     * @param options command options; {@link TriggerCommandOptions#verify()} requires a catalog
     * @param catalog live trigger catalog, may be null when not verifying
     * @param console operator output
     */
    public GenerationResult generate(TriggerCommandOptions options, TriggerCatalog catalog, OperatorConsole console) {
        if (options.verify() && catalog == null) {
            throw new IllegalArgumentException("Verifying installed triggers needs a database connection");
        }
        TriggerDialect dialect = TriggerDialects.forVendor(options.vendor());
        List<String> skipped = new ArrayList<>();

        Map<String, Map<String, TriggerInfo>> byApp = new TreeMap<>();
        for (SelectionModel model : TargetModels.select(registry, options, console)) {
            if (options.verbose()) {
                console.info("Processing model: " + model.label());
            }
            MigrationDirectory directory = locations.directoryFor(model.label().app(), options.migrationDir());
            for (TriggerInfo info : scanner.installedTriggers(model, directory)) {
                if (options.verify() && !catalog.exists(info.triggerName())) {
                    console.warning("Trigger %s is not installed in the database. Skipping..."
                            .formatted(info.triggerName()));
                    skipped.add(info.triggerName());
                    continue;
                }
                if (options.verbose()) {
                    console.info("Found trigger %s in %s".formatted(info.triggerName(), info.migrationFile().fileName()));
                }
                byApp.computeIfAbsent(info.app(), app -> new LinkedHashMap<>()).putIfAbsent(info.triggerName(), info);
            }
        }

        if (byApp.isEmpty()) {
            console.info("No triggers found to remove.");
            return new GenerationResult(List.of(), List.of(), skipped, options.dryRun());
        }

        MigrationSequence sequence = new MigrationSequence(history);
        List<MigrationFile> migrations = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, Map<String, TriggerInfo>> group : byApp.entrySet()) {
            String app = group.getKey();
            List<String> names = List.copyOf(group.getValue().keySet());

            if (options.interactive()
                    && !console.confirm("Will remove the following triggers from %s: %s. Proceed? (y/n)"
                            .formatted(app, String.join(", ", names)))) {
                console.info("Trigger removal for %s skipped by user.".formatted(app));
                skipped.addAll(names);
                continue;
            }

            MigrationDirectory directory = locations.directoryFor(app, options.migrationDir());
            MigrationSequence.Slot slot = sequence.next(app, directory, MigrationFile.REMOVE_TRIGGERS);
            List<MigrationOperation> operations = group.getValue().values().stream()
                    .map(info -> MigrationOperation.irreversible(
                            "remove trigger " + info.triggerName(),
                            dialect.dropScript(info.triggerName(), info.selectionTable())))
                    .toList();
            String content = new MigrationScript(clock.instant(), slot.dependsOn(), names, operations).render();

            if (options.dryRun()) {
                console.info("[DRY RUN] Would create migration: " + slot.file().path());
                console.info("[DRY RUN] Would remove triggers: " + String.join(", ", names));
                if (options.verbose()) {
                    console.info(content);
                }
            } else {
                directory.write(slot.file(), content);
                console.success("Created migration: " + slot.file().path());
                log.info("Wrote trigger removal migration {} for app {}: {}", slot.file().fileName(), app, names);
            }
            migrations.add(slot.file());
            removed.addAll(names);
        }
        return new GenerationResult(migrations, removed, skipped, options.dryRun());
    }
}
