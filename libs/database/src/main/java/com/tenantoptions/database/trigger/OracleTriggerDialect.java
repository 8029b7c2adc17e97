package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Oracle trigger raising application error {@code -20001}. PL/SQL blocks end with a {@code /} line
 * in scripts.
 * <p>
 * Oracle has no {@code DROP TRIGGER IF EXISTS}; the drop runs in a block that ignores ORA-04080.
 */
final class OracleTriggerDialect implements TriggerDialect {

    @Override
    public DatabaseVendor vendor() {
        return DatabaseVendor.ORACLE;
    }

    @Override
    public List<String> createStatements(TriggerTarget target) {
        return List.of(
                """
                CREATE OR REPLACE TRIGGER %s
                BEFORE INSERT ON %s
                FOR EACH ROW
                DECLARE
                    option_tenant_id NUMBER;
                BEGIN
                    SELECT tenant_id INTO option_tenant_id FROM %s WHERE id = :NEW.option_id;
                    IF option_tenant_id IS NOT NULL AND option_tenant_id != :NEW.tenant_id THEN
                        RAISE_APPLICATION_ERROR(-20001, '%s');
                    END IF;
                END;"""
                        .formatted(
                                quote(target.triggerName()),
                                quote(target.selectionTable()),
                                quote(target.optionTable()),
                                MISMATCH_MESSAGE));
    }

    @Override
    public List<String> dropStatements(String triggerName, String selectionTable) {
        return List.of(
                """
                BEGIN
                    EXECUTE IMMEDIATE 'DROP TRIGGER %s';
                EXCEPTION
                    WHEN OTHERS THEN
                        IF SQLCODE != -4080 THEN
                            RAISE;
                        END IF;
                END;"""
                        .formatted(quote(triggerName)));
    }

    @Override
    public String script(List<String> statements) {
        return statements.stream().map(statement -> statement + "\n/").collect(Collectors.joining("\n\n")) + "\n";
    }
}
