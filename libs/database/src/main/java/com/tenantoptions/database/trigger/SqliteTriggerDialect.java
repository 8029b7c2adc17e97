package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.util.List;

/** SQLite trigger using {@code RAISE(FAIL, ...)} inside a {@code WHEN} guarded trigger. */
final class SqliteTriggerDialect implements TriggerDialect {

    @Override
    public DatabaseVendor vendor() {
        return DatabaseVendor.SQLITE;
    }

    @Override
    public List<String> createStatements(TriggerTarget target) {
        String optionTenant = "(SELECT tenant_id FROM %s WHERE id = NEW.option_id)".formatted(quote(target.optionTable()));
        return List.of(
                "DROP TRIGGER IF EXISTS " + quote(target.triggerName()),
                """
                CREATE TRIGGER %s
                BEFORE INSERT ON %s
                FOR EACH ROW
                WHEN %s IS NOT NULL
                    AND %s != NEW.tenant_id
                BEGIN
                    SELECT RAISE(FAIL, '%s');
                END"""
                        .formatted(
                                quote(target.triggerName()),
                                quote(target.selectionTable()),
                                optionTenant,
                                optionTenant,
                                MISMATCH_MESSAGE));
    }

    @Override
    public List<String> dropStatements(String triggerName, String selectionTable) {
        return List.of("DROP TRIGGER IF EXISTS " + quote(triggerName));
    }
}
