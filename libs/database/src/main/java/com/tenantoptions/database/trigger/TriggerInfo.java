package com.tenantoptions.database.trigger;

import com.tenantoptions.database.migration.MigrationFile;
import com.tenantoptions.model.ModelLabel;

/**
 * A trigger found in a migration file.
 *
 * @param triggerName trigger name
 * @param migrationFile newest file installing it
 * @param model selection model the file belongs to
 * @param selectionTable table the trigger is attached to
 */
public record TriggerInfo(String triggerName, MigrationFile migrationFile, ModelLabel model, String selectionTable) {

    public String app() {
        return model.app();
    }
}
