package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;

/** Factory for {@link TriggerDialect} instances. */
public final class TriggerDialects {

    private TriggerDialects() {}

    public static TriggerDialect forVendor(DatabaseVendor vendor) {
        if (vendor == null) {
            throw new IllegalArgumentException("Unsupported database vendor: null");
        }
        return switch (vendor) {
            case SQLITE -> new SqliteTriggerDialect();
            case POSTGRESQL -> new PostgresTriggerDialect();
            case MYSQL -> new MySqlTriggerDialect();
            case ORACLE -> new OracleTriggerDialect();
        };
    }
}
