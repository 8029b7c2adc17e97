package com.tenantoptions.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DatabaseVendor")
class DatabaseVendorTest {

    @Test
    @DisplayName("should carry each vendor's identifier limit")
    void shouldExposeLimits() {
        assertThat(DatabaseVendor.SQLITE.maxIdentifierLength()).isEqualTo(200);
        assertThat(DatabaseVendor.POSTGRESQL.maxIdentifierLength()).isEqualTo(63);
        assertThat(DatabaseVendor.MYSQL.maxIdentifierLength()).isEqualTo(64);
        assertThat(DatabaseVendor.ORACLE.maxIdentifierLength()).isEqualTo(30);
    }

    @Test
    @DisplayName("should resolve configuration keys and JDBC product names")
    void shouldResolve() {
        assertThat(DatabaseVendor.fromKey(" PostgreSQL ")).isEqualTo(DatabaseVendor.POSTGRESQL);
        assertThat(DatabaseVendor.fromProductName("SQLite")).isEqualTo(DatabaseVendor.SQLITE);
        assertThat(DatabaseVendor.fromProductName("Oracle")).isEqualTo(DatabaseVendor.ORACLE);
    }

    @Test
    @DisplayName("should reject unsupported vendors")
    void shouldRejectUnsupported() {
        assertThatThrownBy(() -> DatabaseVendor.fromKey("mssql")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DatabaseVendor.fromProductName("H2")).isInstanceOf(IllegalArgumentException.class);
    }
}
