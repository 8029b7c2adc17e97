package com.tenantoptions.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantoptions.model.DatabaseVendor;
import com.tenantoptions.store.testing.SqliteTestDatabase;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DatabaseVendorResolver")
class DatabaseVendorResolverTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("should prefer the explicit override, then configuration, then metadata")
    void shouldResolveInOrder() {
        var dataSource = SqliteTestDatabase.create(dir).dataSource();

        assertThat(new DatabaseVendorResolver(dataSource, "oracle").resolve("mysql")).isEqualTo(DatabaseVendor.MYSQL);
        assertThat(new DatabaseVendorResolver(dataSource, "oracle").resolve()).isEqualTo(DatabaseVendor.ORACLE);
        assertThat(new DatabaseVendorResolver(dataSource, null).resolve()).isEqualTo(DatabaseVendor.SQLITE);
    }

    @Test
    @DisplayName("should reject unsupported vendors")
    void shouldRejectUnsupported() {
        assertThatThrownBy(() -> new DatabaseVendorResolver(null, "mssql").resolve())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
