package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Vendor-specific SQL for the tenant consistency trigger.
 * <p>
 * The trigger fires before every insert into a selection table and rejects the row when the
 * referenced option has a tenant that differs from the row's tenant. Options without a tenant
 * (mandatory and optional ones) pass.
 *
 * @see TriggerDialects#forVendor(DatabaseVendor)
 */
public interface TriggerDialect {

    /** Message raised by every vendor's trigger. */
    String MISMATCH_MESSAGE = "Tenant mismatch between options and selections";

    DatabaseVendor vendor();

    /** Statements installing the trigger, each executable on its own. */
    List<String> createStatements(TriggerTarget target);

    /** Statements removing the trigger; they succeed when the trigger is already gone. */
    List<String> dropStatements(String triggerName, String selectionTable);

    /** Joins statements into a migration script the vendor's Flyway parser can split. */
    default String script(List<String> statements) {
        return statements.stream().map(statement -> statement + ";").collect(Collectors.joining("\n\n")) + "\n";
    }

    default String createScript(TriggerTarget target) {
        return script(createStatements(target));
    }

    default String dropScript(String triggerName, String selectionTable) {
        return script(dropStatements(triggerName, selectionTable));
    }

    default String quote(String identifier) {
        return TriggerNames.quote(identifier, vendor());
    }
}
