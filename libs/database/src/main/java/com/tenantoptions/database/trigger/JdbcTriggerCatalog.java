package com.tenantoptions.database.trigger;

import com.tenantoptions.model.DatabaseVendor;
import org.springframework.jdbc.core.simple.JdbcClient;

/** Looks triggers up in the vendor's system catalog. */
public class JdbcTriggerCatalog implements TriggerCatalog {

    private final JdbcClient jdbc;
    private final DatabaseVendor vendor;

    public JdbcTriggerCatalog(JdbcClient jdbc, DatabaseVendor vendor) {
        this.jdbc = jdbc;
        this.vendor = vendor;
    }

    @Override
    public boolean exists(String triggerName) {
        String sql = switch (vendor) {
            case SQLITE -> "SELECT COUNT(*) FROM sqlite_master WHERE type = 'trigger' AND name = ?";
            case POSTGRESQL -> "SELECT COUNT(*) FROM information_schema.triggers WHERE trigger_name = ?";
            case MYSQL -> "SELECT COUNT(*) FROM information_schema.triggers"
                    + " WHERE trigger_schema = DATABASE() AND trigger_name = ?";
            case ORACLE -> "SELECT COUNT(*) FROM user_triggers WHERE trigger_name = ?";
        };
        Long count = jdbc.sql(sql).param(triggerName).query(Long.class).single();
        return count != null && count > 0;
    }
}
