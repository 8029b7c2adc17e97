package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.util.List;

/**
 * PostgreSQL trigger backed by a PL/pgSQL function named after the trigger with a {@code _func}
 * suffix. The function raises SQLSTATE {@code 23514} so the failure reads as a check violation.
 */
final class PostgresTriggerDialect implements TriggerDialect {

    @Override
    public DatabaseVendor vendor() {
        return DatabaseVendor.POSTGRESQL;
    }

    @Override
    public List<String> createStatements(TriggerTarget target) {
        String function = functionName(target.triggerName());
        return List.of(
                """
                CREATE OR REPLACE FUNCTION %s() RETURNS TRIGGER AS $$
                DECLARE
                    option_tenant_id BIGINT;
                BEGIN
                    SELECT tenant_id INTO option_tenant_id FROM %s WHERE id = NEW.option_id;
                    IF option_tenant_id IS NOT NULL AND option_tenant_id != NEW.tenant_id THEN
                        RAISE EXCEPTION '%s' USING ERRCODE = '23514';
                    END IF;
                    RETURN NEW;
                END;
                $$ LANGUAGE plpgsql"""
                        .formatted(function, quote(target.optionTable()), MISMATCH_MESSAGE),
                "DROP TRIGGER IF EXISTS %s ON %s"
                        .formatted(quote(target.triggerName()), quote(target.selectionTable())),
                """
                CREATE TRIGGER %s
                BEFORE INSERT ON %s
                FOR EACH ROW EXECUTE FUNCTION %s()"""
                        .formatted(quote(target.triggerName()), quote(target.selectionTable()), function));
    }

    @Override
    public List<String> dropStatements(String triggerName, String selectionTable) {
        return List.of(
                "DROP TRIGGER IF EXISTS %s ON %s".formatted(quote(triggerName), quote(selectionTable)),
                "DROP FUNCTION IF EXISTS %s()".formatted(functionName(triggerName)));
    }

    private String functionName(String triggerName) {
        return quote(triggerName + "_func");
    }
}
