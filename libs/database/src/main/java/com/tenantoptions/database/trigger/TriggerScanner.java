package com.tenantoptions.database.trigger;

import com.tenantoptions.database.migration.AppliedMigration;
import com.tenantoptions.database.migration.MigrationDirectory;
import com.tenantoptions.database.migration.MigrationFile;
import com.tenantoptions.model.SelectionModel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds trigger creations and removals in migration files.
 * <p>
 * A trigger counts as installed when the newest migration mentioning it creates it. Applied
 * migrations whose file is no longer on disk are judged by their script name.
 */
public final class TriggerScanner {

    static final Pattern DROP_IF_EXISTS = Pattern.compile("DROP TRIGGER IF EXISTS\\s+[\"`]?([A-Za-z0-9_]+)");
    static final Pattern ANY_DROP = Pattern.compile("DROP TRIGGER(?:\\s+IF\\s+EXISTS)?\\s+[\"`]?([A-Za-z0-9_]+)");
    static final Pattern TRIGGER_LINE = Pattern.compile("^-- Trigger: ([A-Za-z0-9_]+)\\s*$", Pattern.MULTILINE);
    static final Pattern CREATE = Pattern.compile(
            "CREATE\\s+(?:OR\\s+REPLACE\\s+)?TRIGGER\\s+[\"`]?([A-Za-z0-9_]+)", Pattern.CASE_INSENSITIVE);

    /**
     * Whether the newest mention of the trigger, on disk or in the applied history, creates it.
     *
     * @param triggerName trigger to look for
     * @param modelName lower-case selection model name, matched against applied script names
     * @param directory the app's migration directory
     * @param applied the app's applied migrations
     */
    public boolean isInstalled(
            String triggerName, String modelName, MigrationDirectory directory, List<AppliedMigration> applied) {
        int newestVersion = 0;
        boolean created = false;
        Set<String> onDisk = new LinkedHashSet<>();

        for (MigrationFile file : directory.files()) {
            onDisk.add(file.fileName());
            String content = file.read();
            if (!content.contains(triggerName)) {
                continue;
            }
            if (file.version() >= newestVersion) {
                newestVersion = file.version();
                created = names(CREATE, content).contains(triggerName);
            }
        }
        for (AppliedMigration migration : applied) {
            if (migration.script() == null || onDisk.contains(migration.script()) || !migration.success()) {
                continue;
            }
            int version = migration.numericVersion().orElse(0);
            if (migration.script().contains("auto_trigger_" + modelName) && version > newestVersion) {
                newestVersion = version;
                created = true;
            }
        }
        return created;
    }

    /**
     * Triggers installed by migrations named after the model, {@code auto_trigger_{model}} or
     * {@code trigger...{model}}, leaving out those dropped by a later removal migration.
     */
    public List<TriggerInfo> installedTriggers(SelectionModel model, MigrationDirectory directory) {
        String modelName = model.label().modelName();
        Pattern fileName = Pattern.compile(
                "auto_trigger_" + Pattern.quote(modelName) + "|trigger.*" + Pattern.quote(modelName));
        List<MigrationFile> files = directory.files();

        Map<String, TriggerInfo> found = new LinkedHashMap<>();
        for (MigrationFile file : files) {
            if (file.isRemoval() || !fileName.matcher(file.description().toLowerCase(Locale.ROOT)).find()) {
                continue;
            }
            String content = file.read();
            Set<String> triggers = new LinkedHashSet<>(names(DROP_IF_EXISTS, content));
            triggers.addAll(names(TRIGGER_LINE, content));
            for (String trigger : triggers) {
                found.put(trigger, new TriggerInfo(trigger, file, model.label(), model.table()));
            }
        }

        List<TriggerInfo> installed = new ArrayList<>();
        for (TriggerInfo info : found.values()) {
            if (!droppedAfter(info, files)) {
                installed.add(info);
            }
        }
        return installed;
    }

    // ── Private Helpers ──

    private static boolean droppedAfter(TriggerInfo info, List<MigrationFile> files) {
        return files.stream()
                .filter(MigrationFile::isRemoval)
                .filter(file -> file.version() > info.migrationFile().version())
                .anyMatch(file -> names(ANY_DROP, file.read()).contains(info.triggerName()));
    }

    private static Set<String> names(Pattern pattern, String content) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
