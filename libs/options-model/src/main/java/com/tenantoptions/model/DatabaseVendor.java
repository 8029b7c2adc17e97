package com.tenantoptions.model;

import java.util.Locale;

/**
 * Relational stores the trigger generator can target, with each vendor's maximum identifier
 * length.
 */
public enum DatabaseVendor {
    SQLITE("sqlite", 200),
    POSTGRESQL("postgresql", 63),
    MYSQL("mysql", 64),
    ORACLE("oracle", 30);

    private final String key;
    private final int maxIdentifierLength;

    DatabaseVendor(String key, int maxIdentifierLength) {
        this.key = key;
        this.maxIdentifierLength = maxIdentifierLength;
    }

    /** Lower-case key used in configuration and on the command line. */
    public String key() {
        return key;
    }

    public int maxIdentifierLength() {
        return maxIdentifierLength;
    }

    /**
     * Resolves a configuration key such as "postgresql".
     *
     * @throws IllegalArgumentException if the vendor is not supported
     */
    public static DatabaseVendor fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("database vendor must not be null or blank");
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (DatabaseVendor vendor : values()) {
            if (vendor.key.equals(normalized)) {
                return vendor;
            }
        }
        throw new IllegalArgumentException("Unsupported database vendor: " + key);
    }

    /**
     * Resolves the product name reported by JDBC metadata ("PostgreSQL", "SQLite", "MySQL",
     * "Oracle").
     *
     * @throws IllegalArgumentException if the product is not supported
     */
    public static DatabaseVendor fromProductName(String productName) {
        if (productName == null) {
            throw new IllegalArgumentException("database product name must not be null");
        }
        String normalized = productName.toLowerCase(Locale.ROOT);
        for (DatabaseVendor vendor : values()) {
            if (normalized.contains(vendor.key)) {
                return vendor;
            }
        }
        throw new IllegalArgumentException("Unsupported database vendor: " + productName);
    }
}
