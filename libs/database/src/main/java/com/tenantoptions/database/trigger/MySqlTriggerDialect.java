package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.util.List;
import java.util.stream.Collectors;

/**
 * MySQL trigger signalling SQLSTATE {@code 45000}. Compound statements are wrapped in
 * {@code DELIMITER} blocks in scripts.
 */
final class MySqlTriggerDialect implements TriggerDialect {

    @Override
    public DatabaseVendor vendor() {
        return DatabaseVendor.MYSQL;
    }

    @Override
    public List<String> createStatements(TriggerTarget target) {
        return List.of(
                "DROP TRIGGER IF EXISTS " + quote(target.triggerName()),
                """
                CREATE TRIGGER %s
                BEFORE INSERT ON %s
                FOR EACH ROW
                BEGIN
                    DECLARE option_tenant_id BIGINT;
                    SELECT tenant_id INTO option_tenant_id FROM %s WHERE id = NEW.option_id;
                    IF option_tenant_id IS NOT NULL AND option_tenant_id != NEW.tenant_id THEN
                        SIGNAL SQLSTATE '45000' SET MESSAGE_TEXT = '%s';
                    END IF;
                END"""
                        .formatted(
                                quote(target.triggerName()),
                                quote(target.selectionTable()),
                                quote(target.optionTable()),
                                MISMATCH_MESSAGE));
    }

    @Override
    public List<String> dropStatements(String triggerName, String selectionTable) {
        return List.of("DROP TRIGGER IF EXISTS " + quote(triggerName));
    }

    @Override
    public String script(List<String> statements) {
        return statements.stream()
                        .map(statement -> statement.contains("BEGIN")
                                ? "DELIMITER //\n" + statement + "//\nDELIMITER ;"
                                : statement + ";")
                        .collect(Collectors.joining("\n\n"))
                + "\n";
    }
}
