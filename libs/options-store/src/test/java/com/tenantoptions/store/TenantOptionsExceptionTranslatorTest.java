package com.tenantoptions.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("TenantOptionsExceptionTranslator")
class TenantOptionsExceptionTranslatorTest {

    private final TenantOptionsExceptionTranslator translator = new TenantOptionsExceptionTranslator();

    @Test
    @DisplayName("should translate SQLSTATE class 23")
    void shouldTranslateIntegrityState() {
        var translated = translator.translate("insert", "INSERT", new SQLException("dup", "23505"));

        assertThat(translated).isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("should translate trigger signals of MySQL and Oracle")
    void shouldTranslateTriggerSignals() {
        assertThat(translator.translate("insert", null, new SQLException("signal", "45000", 1644)))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(translator.translate("insert", null, new SQLException("ORA-20001", "72000", 20001)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("should translate SQLite constraint codes including extended ones")
    void shouldTranslateSqliteConstraint() {
        var unique = new SQLiteException("unique", SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE);
        var trigger = new SQLiteException("trigger", SQLiteErrorCode.SQLITE_CONSTRAINT_TRIGGER);

        assertThat(translator.translate("insert", null, unique)).isInstanceOf(DataIntegrityViolationException.class);
        assertThat(translator.translate("insert", null, trigger)).isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("should leave other failures to the default translation")
    void shouldFallBack() {
        var busy = new SQLiteException("busy", SQLiteErrorCode.SQLITE_BUSY);

        assertThat(translator.translate("select", null, busy)).isNull();
        assertThat(translator.translate("select", null, new SQLException("down", "08001")))
                .isNotNull()
                .isNotInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("should let JdbcTemplate wrap unclassified failures as uncategorized")
    void shouldSurfaceUnclassifiedAsUncategorized() throws SQLException {
        var busy = new SQLiteException("busy", SQLiteErrorCode.SQLITE_BUSY);
        Connection connection = mock(Connection.class);
        when(connection.createStatement()).thenThrow(busy);
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenReturn(connection);
        var template = new JdbcTemplate(dataSource);
        template.setExceptionTranslator(translator);

        assertThatThrownBy(() -> template.execute("SELECT 1"))
                .isInstanceOf(UncategorizedSQLException.class)
                .hasCause(busy);
    }
}
