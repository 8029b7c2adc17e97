package com.tenantoptions.database.migration;

import com.tenantoptions.database.trigger.TriggerNames;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;

/** Reads the Flyway history table of an app, {@code {app}_schema_history} by default. */
public class JdbcMigrationHistory implements MigrationHistory {

    private static final Logger log = LoggerFactory.getLogger(JdbcMigrationHistory.class);

    private final JdbcClient jdbc;
    private final MigrationLocations locations;

    public JdbcMigrationHistory(JdbcClient jdbc, MigrationLocations locations) {
        this.jdbc = jdbc;
        this.locations = locations;
    }

    @Override
    public List<AppliedMigration> applied(String app) {
        String table = TriggerNames.validate(locations.historyTable(app));
        try {
            return jdbc.sql("""
                            SELECT version, description, script, success
                            FROM %s
                            ORDER BY installed_rank
                            """.formatted(table))
                    .query((rs, rowNum) -> new AppliedMigration(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("script"),
                            rs.getBoolean("success")))
                    .list();
        } catch (DataAccessException e) {
            log.debug("No migration history in {} for app {}: {}", table, app, e.getMessage());
            return List.of();
        }
    }
}
