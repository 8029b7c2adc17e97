package com.tenantoptions.database.migration;

/**
 * One operation of a generated migration.
 *
 * @param description short label rendered as a comment
 * @param sql forward script
 * @param reverseSql script undoing the operation, null when reversing is a no-op
 */
public record MigrationOperation(String description, String sql, String reverseSql) {

    public MigrationOperation {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be blank");
        }
    }

    public static MigrationOperation irreversible(String description, String sql) {
        return new MigrationOperation(description, sql, null);
    }

    public boolean isReversible() {
        return reverseSql != null && !reverseSql.isBlank();
    }
}
