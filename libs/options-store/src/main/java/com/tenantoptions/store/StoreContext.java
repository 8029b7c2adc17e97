package com.tenantoptions.store;

import com.tenantoptions.model.DatabaseVendor;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Map;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Collaborators every repository needs: the JDBC client, transaction boundaries, the clock that
 * stamps soft deletes, the lifecycle policy and the target vendor.
 */
public record StoreContext(JdbcClient jdbc, TransactionTemplate transactions, Clock clock,
                           LifecyclePolicy policy, DatabaseVendor vendor) {

    public StoreContext {
        if (jdbc == null || transactions == null || clock == null || policy == null || vendor == null) {
            throw new IllegalArgumentException("store context collaborators must not be null");
        }
    }

    /** Current time as a JDBC timestamp for the {@code deleted} column. */
    public Timestamp now() {
        return Timestamp.from(clock.instant());
    }

    /**
     * Executes an INSERT and returns the generated id. SQLite and PostgreSQL use
     * {@code RETURNING id}; other vendors go through the driver's generated keys.
     */
    public long insertReturningId(String insertSql, Map<String, ?> params) {
        if (vendor == DatabaseVendor.SQLITE || vendor == DatabaseVendor.POSTGRESQL) {
            return jdbc.sql(insertSql + " RETURNING id").params(params).query(Long.class).single();
        }
        var keys = new GeneratedKeyHolder();
        jdbc.sql(insertSql).params(params).update(keys, "id");
        Number key = keys.getKey();
        if (key == null) {
            throw new IllegalStateException("No generated key returned for: " + insertSql);
        }
        return key.longValue();
    }
}
